package com.restaurant.simulator.engine;

import com.restaurant.simulator.model.SalesBucketRow;

import java.util.List;

/**
 * One day's buckets plus the day-level figures the derived series need.
 */
public record DayAllocation(List<SalesBucketRow> buckets,
                            double avgTicket,
                            int covers,
                            int tickets,
                            double grossSales,
                            double netSales) {}
