package com.example.memocache.loadgen;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Draws region names with Zipfian popularity: {@code region-1} is the hottest key,
 * {@code region-N} the coldest.
 */
public class RegionSampler {

    private final ZipfDistribution zipf;

    public RegionSampler(int regions, double exponent) {
        this(new Well19937c(), regions, exponent);
    }

    public RegionSampler(RandomGenerator random, int regions, double exponent) {
        this.zipf = new ZipfDistribution(random, regions, exponent);
    }

    public String next() {
        return "region-" + zipf.sample();
    }

    public int regions() {
        return zipf.getNumberOfElements();
    }
}
