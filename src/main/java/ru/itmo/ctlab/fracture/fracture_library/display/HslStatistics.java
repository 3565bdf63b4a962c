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
package ru.itmo.ctlab.fracture.fracture_library.display;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.color.HslConversion;

import java.awt.*;

/**
 * Per-render HSL ranges of the enabled channels; disabled channels are {@code null}.
 */
public record HslStatistics(@Nullable ChannelRange hue, @Nullable ChannelRange saturation,
                            @Nullable ChannelRange lightness) {

  public static @NotNull HslStatistics scan(final Color @NotNull [][] colors, final boolean hue, final boolean saturation, final boolean lightness) {
    double minHue = 360.0d, maxHue = 0.0d;
    double minSaturation = 1.0d, maxSaturation = 0.0d;
    double minLightness = 1.0d, maxLightness = 0.0d;

    for (final var column : colors) {
      for (final var color : column) {
        final var hsl = HslConversion.toHsl(color);
        if (hue) {
          minHue = Math.min(minHue, hsl.hue());
          maxHue = Math.max(maxHue, hsl.hue());
        }
        if (saturation) {
          minSaturation = Math.min(minSaturation, hsl.saturation());
          maxSaturation = Math.max(maxSaturation, hsl.saturation());
        }
        if (lightness) {
          minLightness = Math.min(minLightness, hsl.lightness());
          maxLightness = Math.max(maxLightness, hsl.lightness());
        }
      }
    }

    return new HslStatistics(
      hue ? new ChannelRange(minHue, maxHue) : null,
      saturation ? new ChannelRange(minSaturation, maxSaturation) : null,
      lightness ? new ChannelRange(minLightness, maxLightness) : null
    );
  }
}
