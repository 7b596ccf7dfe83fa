package com.restaurant.simulator.engine;

import com.restaurant.simulator.config.GeneratorProperties;
import com.restaurant.simulator.engine.random.BitMixer;
import com.restaurant.simulator.engine.random.NormalSampler;
import com.restaurant.simulator.model.GeneratorOverrides;
import com.restaurant.simulator.model.SalesBucketRow;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spreads a day's sales level over fixed-width service buckets using a fixed
 * demand curve, then splits every bucket across dine-in, pickup and delivery.
 *
 * Gross sales are apportioned in cents, so the buckets of a day always sum to
 * the day's sales level rounded to the cent. Covers are apportioned the same
 * way.
 */
public class IntradayAllocator {

    private final GeneratorProperties.Intraday settings;
    private final double avgTicketMean;
    private final List<LocalTime> slotStarts;
    private final double[] slotWeights;

    public IntradayAllocator(GeneratorProperties.Intraday settings, int openHour, int closeHour, double avgTicketMean) {
        this.settings = settings;
        this.avgTicketMean = avgTicketMean;

        int slotsPerHour = 60 / settings.getSlotMinutes();
        Map<Integer, Double> hourWeights = settings.getHourWeights();

        this.slotStarts = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int hour = openHour; hour <= closeHour; hour++) {
            Double configured = hourWeights != null ? hourWeights.get(hour) : null;
            double hourWeight = configured != null ? configured : settings.getOffPeakWeight();
            for (int slot = 0; slot < slotsPerHour; slot++) {
                slotStarts.add(LocalTime.of(hour, slot * settings.getSlotMinutes()));
                weights.add(hourWeight / slotsPerHour);
            }
        }
        this.slotWeights = weights.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static IntradayAllocator from(GeneratorProperties.Intraday settings, GeneratorOverrides overrides) {
        return new IntradayAllocator(settings,
                GeneratorOverrides.or(overrides.getOpenHour(), settings.getOpenHour()),
                GeneratorOverrides.or(overrides.getCloseHour(), settings.getCloseHour()),
                GeneratorOverrides.or(overrides.getAvgTicketMean(), settings.getAvgTicketMean()));
    }

    public int slotsPerDay() {
        return slotStarts.size();
    }

    /**
     * Share of the day that falls in each slot; sums to 1.
     */
    public double[] slotFractions() {
        double sum = 0.0;
        for (double w : slotWeights) sum += w;
        double[] fractions = new double[slotWeights.length];
        for (int i = 0; i < slotWeights.length; i++) {
            fractions[i] = slotWeights[i] / sum;
        }
        return fractions;
    }

    public DayAllocation allocate(String locationId, DayRecord day, ZoneId zone, BitMixer intradayStream) {
        NormalSampler sampler = new NormalSampler(intradayStream);
        double avgTicket = Math.max(settings.getMinAvgTicket(),
                sampler.normal(avgTicketMean, settings.getAvgTicketStd()));

        long dayCents = Money.toCents(day.salesLevel());
        int covers = (int) Math.max(1, Math.round(day.salesLevel() / avgTicket));

        long[] grossCents = Money.apportion(dayCents, slotWeights);
        long[] slotCovers = Money.apportion(covers, slotWeights);

        List<SalesBucketRow> buckets = new ArrayList<>(slotStarts.size());
        long totalGross = 0;
        long totalNet = 0;
        int totalTickets = 0;

        for (int i = 0; i < slotStarts.size(); i++) {
            long gross = grossCents[i];
            int bucketCovers = (int) slotCovers[i];
            int tickets = bucketCovers == 0 ? 0
                    : (int) Math.max(1, Math.round(bucketCovers / settings.getCoversPerTicket()));

            double dineInShare = settings.getDineInMin() + intradayStream.next() * settings.getDineInSpan();
            double pickupShare = settings.getPickupMin() + intradayStream.next() * settings.getPickupSpan();
            long dineIn = Math.round(gross * dineInShare);
            long pickup = Math.round(gross * pickupShare);
            long delivery = gross - dineIn - pickup;

            long discounts = Math.round(gross * settings.getDiscountPct());
            long net = gross - discounts;

            double voids = intradayStream.nextBoolean(settings.getVoidProbability()) ? settings.getVoidAmount() : 0.0;
            double comps = intradayStream.nextBoolean(settings.getCompProbability()) ? settings.getCompAmount() : 0.0;
            double refunds = intradayStream.nextBoolean(settings.getRefundProbability()) ? settings.getRefundAmount() : 0.0;

            OffsetDateTime timestamp = day.date().atTime(slotStarts.get(i)).atZone(zone).toOffsetDateTime();

            buckets.add(SalesBucketRow.builder()
                    .locationId(locationId)
                    .timestamp(timestamp)
                    .salesGross(Money.fromCents(gross))
                    .salesNet(Money.fromCents(net))
                    .tickets(tickets)
                    .covers(bucketCovers)
                    .discounts(Money.fromCents(discounts))
                    .voids(voids)
                    .comps(comps)
                    .refunds(refunds)
                    .channelDineIn(Money.fromCents(dineIn))
                    .channelPickup(Money.fromCents(pickup))
                    .channelDelivery(Money.fromCents(delivery))
                    .build());

            totalGross += gross;
            totalNet += net;
            totalTickets += tickets;
        }

        return new DayAllocation(buckets, avgTicket, covers, totalTickets,
                Money.fromCents(totalGross), Money.fromCents(totalNet));
    }
}
