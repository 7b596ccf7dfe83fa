package com.restaurant.simulator.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.WritePolicy;
import com.restaurant.simulator.config.AerospikeConfig;
import com.restaurant.simulator.model.GeneratedDataset;
import com.restaurant.simulator.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GeneratedRowRepositoryTest {

    private AerospikeClient client;
    private WritePolicy writePolicy;
    private GeneratedRowRepository repository;

    @BeforeEach
    void setUp() {
        client = mock(AerospikeClient.class);
        writePolicy = new WritePolicy();
        repository = new GeneratedRowRepository(client, "test", writePolicy, TestDataFactory.defaultProperties());
    }

    @Test
    void saveAll_writesOneRecordPerRow() {
        GeneratedDataset dataset = TestDataFactory.createSmallDataset("loc-1");

        int written = repository.saveAll(dataset);

        assertThat(written).isEqualTo(5);
        verify(client, times(5)).put(eq(writePolicy), any(Key.class), any(Bin[].class));
    }

    @Test
    void saveAll_usesOneSetPerFamily_withDeterministicKeys() {
        repository.saveAll(TestDataFactory.createSmallDataset("loc-1"));

        ArgumentCaptor<Key> keys = ArgumentCaptor.forClass(Key.class);
        verify(client, times(5)).put(eq(writePolicy), keys.capture(), any(Bin[].class));
        List<Key> captured = keys.getAllValues();

        assertThat(captured).extracting(k -> k.setName).containsExactly(
                AerospikeConfig.SET_SALES_15M, AerospikeConfig.SET_SALES_15M,
                AerospikeConfig.SET_LABOR_DAILY, AerospikeConfig.SET_ITEM_MIX_DAILY,
                AerospikeConfig.SET_INVENTORY_DAILY);
        assertThat(captured).allMatch(k -> "test".equals(k.namespace));
        assertThat(captured.get(2).userKey.toString()).isEqualTo("loc-1:2026-02-20");
        assertThat(captured.get(3).userKey.toString()).isEqualTo("loc-1:2026-02-20:item-1");
    }

    @Test
    void sameRows_mapToSameKeys() {
        GeneratedDataset dataset = TestDataFactory.createSmallDataset("loc-1");
        repository.saveAll(dataset);
        repository.saveAll(dataset);

        ArgumentCaptor<Key> keys = ArgumentCaptor.forClass(Key.class);
        verify(client, times(10)).put(eq(writePolicy), keys.capture(), any(Bin[].class));
        List<Key> captured = keys.getAllValues();

        assertThat(captured.subList(5, 10)).isEqualTo(captured.subList(0, 5));
    }

    @Test
    void emptyDataset_writesNothing() {
        assertThat(repository.saveAll(GeneratedDataset.empty())).isZero();
        verifyNoInteractions(client);
    }

    @Test
    void writeFailure_propagates() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.saveAll(TestDataFactory.createSmallDataset("loc-1")))
                .isInstanceOf(AerospikeException.class);
    }
}
