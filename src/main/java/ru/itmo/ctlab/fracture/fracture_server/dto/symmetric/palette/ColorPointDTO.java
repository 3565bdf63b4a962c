/*
 * MIT License
 *
 * Copyright (c) 2021-2024. Aleksandr Serdiukov, Anton Zamyatin, Aleksandr Sinitsyn, Vitalii Dravgelis and Computer Technologies Laboratory ITMO University team.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.palette;

import io.vertx.core.json.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.palette.ColorPoint;

import java.awt.*;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Color point on the wire. {@code index} is informational: a point is always placed by its position.
 */
public record ColorPointDTO(@NotNull String colorRGBAString, double position, @Nullable Integer index) {
  private static final Pattern RGBA_EXTRACT_PATTERN = Pattern.compile("rgba\\p{Zs}*\\(\\p{Zs}*(?<red>\\d+)\\p{Zs}*,\\p{Zs}*(?<green>\\d+)\\p{Zs}*,\\p{Zs}*(?<blue>\\d+)\\p{Zs}*,\\p{Zs}*(?<alpha>[+-]?\\d+[.,]?\\d*)\\p{Zs}*\\)");

  public static @NotNull String toRGBAString(final @NotNull Color color) {
    return String.format(Locale.US, "rgba(%d,%d,%d,%f)", color.getRed(), color.getGreen(), color.getBlue(), ((double) color.getAlpha() / 255.0d));
  }

  public static @NotNull Color parseRGBAString(final @NotNull String rgba) {
    final var matcher = RGBA_EXTRACT_PATTERN.matcher(rgba);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Wrong RGBA color: " + rgba);
    }
    final var red = Integer.parseInt(matcher.group("red"));
    final var green = Integer.parseInt(matcher.group("green"));
    final var blue = Integer.parseInt(matcher.group("blue"));
    final var alpha = (int) Math.round(255.0d * Double.parseDouble(matcher.group("alpha").replaceAll(",", ".")));
    if (red > 255 || green > 255 || blue > 255 || alpha < 0 || alpha > 255) {
      throw new IllegalArgumentException("RGBA color components are out of range: " + rgba);
    }
    return new Color(red, green, blue, alpha);
  }

  public static @NotNull ColorPointDTO fromEntity(final @NotNull ColorPoint point, final @Nullable Integer index) {
    return new ColorPointDTO(toRGBAString(point.getPointColor()), point.getPosition(), index);
  }

  public static @NotNull ColorPointDTO fromJSONObject(final @NotNull JsonObject json) {
    return new ColorPointDTO(
      json.getString("colorRGBAString"),
      json.getDouble("position"),
      json.getInteger("index")
    );
  }

  public @NotNull ColorPoint toEntity() {
    return new ColorPoint(parseRGBAString(this.colorRGBAString), this.position);
  }
}
