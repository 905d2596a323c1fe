package io.github.manjago.mathcaptcha.render;

import io.github.manjago.mathcaptcha.core.InvalidConfigException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts user-facing color strings to dvipng {@code -fg}/{@code -bg} arguments.
 * <p>
 * Accepted forms:
 * <pre>
 * #RRGGBB or RRGGBB       hex, 0-255 per channel
 * rgb(r,g,b) / rgb r g b  0-255 or 0-1 per channel
 * ...transparent...       passed through unchanged (any case)
 * </pre>
 * If any channel is above 1 the whole triplet is treated as 0-255 and scaled
 * down. Output is {@code rgb R G B} with three decimals per channel.
 */
public final class ColorParser {

    private static final Pattern TRANSPARENT_PATTERN = Pattern.compile("transparent", Pattern.CASE_INSENSITIVE);
    private static final Pattern RGB_PATTERN = Pattern.compile(
            "rgb[( ]?(\\d{1,3}\\.?\\d*)[, ]+(\\d{1,3}\\.?\\d*)[, ]+(\\d{1,3}\\.?\\d*)\\)?");
    private static final Pattern HEX_PATTERN = Pattern.compile("#?([0-9A-Fa-f]{6})");

    private ColorParser() {
        // Utility class
    }

    /**
     * @param color color in one of the accepted forms
     * @return dvipng color argument
     * @throws InvalidConfigException if the color cannot be parsed
     */
    @Contract(pure = true)
    public static @NotNull String toDvipng(@NotNull String color) {
        if (TRANSPARENT_PATTERN.matcher(color).find()) {
            return color;
        }

        double red;
        double green;
        double blue;

        Matcher rgb = RGB_PATTERN.matcher(color);
        Matcher hex = HEX_PATTERN.matcher(color.trim());
        if (rgb.find()) {
            red = Double.parseDouble(rgb.group(1));
            green = Double.parseDouble(rgb.group(2));
            blue = Double.parseDouble(rgb.group(3));
        } else if (hex.matches()) {
            String digits = hex.group(1);
            red = Integer.parseInt(digits.substring(0, 2), 16);
            green = Integer.parseInt(digits.substring(2, 4), 16);
            blue = Integer.parseInt(digits.substring(4, 6), 16);
        } else {
            throw new InvalidConfigException("Unrecognized color: '" + color + "'");
        }

        if (red > 1 || green > 1 || blue > 1) {
            red /= 255;
            green /= 255;
            blue /= 255;
        }

        return String.format(Locale.ROOT, "rgb %.3f %.3f %.3f", red, green, blue);
    }
}
