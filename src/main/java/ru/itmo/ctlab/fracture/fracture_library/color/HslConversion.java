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
package ru.itmo.ctlab.fracture.fracture_library.color;

import org.jetbrains.annotations.NotNull;

import java.awt.*;

/**
 * Conversion between byte RGB colors and {@link Hsl}.
 */
public final class HslConversion {
  private HslConversion() {
  }

  private enum DominantChannel {
    RED,
    GREEN,
    BLUE,
    NONE
  }

  private static DominantChannel dominantChannel(final int red, final int green, final int blue, final int min, final int max) {
    if (max == min) {
      return DominantChannel.NONE;
    }
    if (red == max) {
      return DominantChannel.RED;
    }
    if (green == max) {
      return DominantChannel.GREEN;
    }
    return DominantChannel.BLUE;
  }

  private static double hue(final int red, final int green, final int blue, final int min, final int max, final @NotNull DominantChannel dominant) {
    final double chroma = max - min;
    return switch (dominant) {
      case RED -> 60.0d * (((green - blue) / chroma) % 6);
      case GREEN -> 60.0d * ((blue - red) / chroma + 2.0d);
      case BLUE -> 60.0d * ((red - green) / chroma + 4.0d);
      case NONE -> 0.0d;
    };
  }

  private static double lightness(final int max, final int min) {
    return (max / 255.0d + min / 255.0d) / 2;
  }

  private static double saturation(final int max, final int min, final double lightness) {
    if (min == max) {
      return 0.0d;
    }
    final var delta = max / 255.0d - min / 255.0d;
    if (lightness <= 0.5d) {
      return delta / (2 * lightness);
    }
    return delta / (2.0d - 2 * lightness);
  }

  public static @NotNull Hsl toHsl(final int red, final int green, final int blue) {
    final var max = Math.max(Math.max(red, green), blue);
    final var min = Math.min(Math.min(red, green), blue);
    final var dominant = dominantChannel(red, green, blue, min, max);
    final var hue = Hsl.wrapHue(hue(red, green, blue, min, max, dominant));
    final var lightness = Math.min(1.0d, Math.max(0.0d, lightness(max, min)));
    return new Hsl(hue, saturation(max, min, lightness), lightness);
  }

  public static @NotNull Hsl toHsl(final @NotNull Color color) {
    return toHsl(color.getRed(), color.getGreen(), color.getBlue());
  }

  public static @NotNull Hsl toHsl(final @NotNull Rgb rgb) {
    return toHsl(
      (int) Math.round(rgb.red() * 255.0d),
      (int) Math.round(rgb.green() * 255.0d),
      (int) Math.round(rgb.blue() * 255.0d)
    );
  }

  public static @NotNull Rgb toUnitRgb(final @NotNull Hsl hsl) {
    final var chroma = (1 - Math.abs(2 * hsl.lightness() - 1)) * hsl.saturation();
    final var sector = hsl.hue() / 60.0d;
    final var x = chroma * (1.0d - Math.abs(sector % 2 - 1));

    final double r, g, b;
    if (sector >= 0 && sector < 1.0d) {
      r = chroma;
      g = x;
      b = 0.0d;
    } else if (sector >= 1.0d && sector < 2.0d) {
      r = x;
      g = chroma;
      b = 0.0d;
    } else if (sector >= 2.0d && sector < 3.0d) {
      r = 0.0d;
      g = chroma;
      b = x;
    } else if (sector >= 3.0d && sector < 4.0d) {
      r = 0.0d;
      g = x;
      b = chroma;
    } else if (sector >= 4.0d && sector < 5.0d) {
      r = x;
      g = 0.0d;
      b = chroma;
    } else if (sector >= 5.0d && sector < 6.0d) {
      r = chroma;
      g = 0.0d;
      b = x;
    } else {
      r = 0.0d;
      g = 0.0d;
      b = 0.0d;
    }

    final var m = hsl.lightness() - 0.5d * chroma;
    return new Rgb(r + m, g + m, b + m);
  }

  public static @NotNull Color toRgb(final @NotNull Hsl hsl, final int alpha) {
    return toUnitRgb(hsl).toColor(alpha);
  }
}
