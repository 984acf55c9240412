package com.stockscan.cn.strategy;

/**
 * Reference-volume day and close-price floor/ceiling over trailing windows.
 * {@code maxVolumeIndex} is an absolute index into the series.
 */
public final class Extrema {
    public final int maxVolumeIndex;
    public final double maxVolume;
    public final double floorPrice;
    public final double ceilingPrice;

    public Extrema(int maxVolumeIndex, double maxVolume, double floorPrice, double ceilingPrice) {
        this.maxVolumeIndex = maxVolumeIndex;
        this.maxVolume = maxVolume;
        this.floorPrice = floorPrice;
        this.ceilingPrice = ceilingPrice;
    }

    public double priceRange() {
        return ceilingPrice - floorPrice;
    }
}
