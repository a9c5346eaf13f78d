package info.isaksson.erland.twaps.view;

final class Spacing {

    private Spacing() {}

    static Double check(Double spacing) {
        if (spacing == null) return null;
        if (spacing.isNaN() || spacing.isInfinite() || spacing < 0.0) {
            throw new IllegalArgumentException("spacing must be a finite, non-negative number: " + spacing);
        }
        // -0.0 renders as 0 and must compare equal to it.
        return spacing == 0.0 ? Double.valueOf(0.0) : spacing;
    }
}
