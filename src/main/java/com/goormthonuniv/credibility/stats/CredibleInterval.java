package com.goormthonuniv.credibility.stats;

public record CredibleInterval(
        double lower,
        double upper
) {
    public static final CredibleInterval FULL = new CredibleInterval(0, 100);

    public CredibleInterval {
        if (lower > upper) throw new IllegalArgumentException("lower > upper: " + lower + " > " + upper);
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double v) {
        return v >= lower && v <= upper;
    }
}
