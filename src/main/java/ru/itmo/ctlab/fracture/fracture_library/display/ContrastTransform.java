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

import lombok.ToString;
import org.apache.commons.lang3.ArrayUtils;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.util.CommonUtils;

import java.awt.*;

/**
 * Linear per-channel stretch of {@code [min, max]} onto {@code [0, 255]}.
 * Slot 0 of the bounds drives blue, slot 1 green and slot 2 red.
 */
@ToString
public class ContrastTransform extends DisplayTransform {
  private static final double RANGE = 255.0d;
  private static final double ROUNDING_BIAS = 0.49999d;

  private final int @NotNull [] min;
  private final double @NotNull [] stretch;

  public ContrastTransform(final int @NotNull [] minRgb, final int @NotNull [] maxRgb) {
    this.min = ArrayUtils.clone(minRgb);
    this.stretch = new double[DisplayConfig.CHANNEL_COUNT];
    for (int i = 0; i < DisplayConfig.CHANNEL_COUNT; ++i) {
      this.stretch[i] = RANGE / (double) (maxRgb[i] - minRgb[i]);
    }
  }

  private int stretchChannel(final int value, final int slot) {
    final var stretched = ((double) value - (double) this.min[slot]) * this.stretch[slot] + ROUNDING_BIAS;
    // min == max gives NaN at min (0 after the cast) and +Infinity above it
    return CommonUtils.clamp((int) stretched, 0, 255);
  }

  @Override
  public @NotNull Color apply(final @NotNull Color color) {
    final var blue = stretchChannel(color.getBlue(), 0);
    final var green = stretchChannel(color.getGreen(), 1);
    final var red = stretchChannel(color.getRed(), 2);
    return new Color(red, green, blue, color.getAlpha());
  }
}
