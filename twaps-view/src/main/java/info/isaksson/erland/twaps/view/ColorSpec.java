package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A foreground color: either a {@link NamedColor} or explicit RGB components in {@code [0, 1]}.
 *
 * <p>Exactly one of {@link #name} or the component fields is set.</p>
 */
@JsonPropertyOrder({"name","red","green","blue","opacity"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ColorSpec {
    public final NamedColor name;
    public final Double red;
    public final Double green;
    public final Double blue;
    public final Double opacity;

    @JsonCreator
    public ColorSpec(
            @JsonProperty("name") NamedColor name,
            @JsonProperty("red") Double red,
            @JsonProperty("green") Double green,
            @JsonProperty("blue") Double blue,
            @JsonProperty("opacity") Double opacity
    ) {
        if (name != null) {
            if (red != null || green != null || blue != null || opacity != null) {
                throw new IllegalArgumentException("named color must not carry RGB components");
            }
            this.name = name;
            this.red = null;
            this.green = null;
            this.blue = null;
            this.opacity = null;
            return;
        }
        this.name = null;
        this.red = unit("red", red);
        this.green = unit("green", green);
        this.blue = unit("blue", blue);
        this.opacity = opacity == null ? 1.0 : unit("opacity", opacity);
    }

    public static ColorSpec named(NamedColor color) {
        if (color == null) throw new IllegalArgumentException("color must not be null");
        return new ColorSpec(color, null, null, null, null);
    }

    public static ColorSpec rgb(double red, double green, double blue) {
        return new ColorSpec(null, red, green, blue, 1.0);
    }

    public static ColorSpec rgb(double red, double green, double blue, double opacity) {
        return new ColorSpec(null, red, green, blue, opacity);
    }

    public boolean hasName() {
        return name != null;
    }

    private static Double unit(String component, Double value) {
        if (value == null) throw new IllegalArgumentException(component + " must not be null");
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(component + " must be within [0, 1]: " + value);
        }
        return value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorSpec)) return false;
        ColorSpec that = (ColorSpec) o;
        return name == that.name &&
                Objects.equals(red, that.red) &&
                Objects.equals(green, that.green) &&
                Objects.equals(blue, that.blue) &&
                Objects.equals(opacity, that.opacity);
    }

    @Override public int hashCode() {
        return Objects.hash(name, red, green, blue, opacity);
    }

    @Override public String toString() {
        if (name != null) return "ColorSpec{" + name + "}";
        return "ColorSpec{rgb(" + red + ", " + green + ", " + blue + ", " + opacity + ")}";
    }
}
