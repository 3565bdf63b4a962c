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

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.awt.*;

/**
 * Post-palette color remap. Instances are immutable and safe to share between rendering threads.
 */
@Slf4j
public abstract class DisplayTransform {
  public static final @NotNull DisplayTransform IDENTITY = new DisplayTransform() {
    @Override
    public @NotNull Color apply(final @NotNull Color color) {
      return color;
    }

    @Override
    public String toString() {
      return "IdentityTransform";
    }
  };

  public abstract @NotNull Color apply(final @NotNull Color color);

  /**
   * Builds the transform selected by {@code config}. HSL remapping scans {@code baseColors}
   * (the pre-transform color of every pixel) for the observed ranges of the enabled channels,
   * so it has to be rebuilt for every render.
   */
  public static @NotNull DisplayTransform create(final @NotNull DisplayConfig config, final Color @NotNull [][] baseColors) {
    final DisplayTransform transform = switch (config.getMode()) {
      case CONTRAST -> new ContrastTransform(config.getMinRgb(), config.getMaxRgb());
      case HSL -> {
        if (!config.isAnyHslChannelEnabled()) {
          yield IDENTITY;
        }
        final var statistics = HslStatistics.scan(baseColors, config.isHue(), config.isSaturation(), config.isLightness());
        log.debug("Observed HSL ranges: " + statistics);
        yield new HslRemapTransform(config, statistics);
      }
      case OFF -> IDENTITY;
    };
    log.debug("Using display transform " + transform);
    return transform;
  }
}
