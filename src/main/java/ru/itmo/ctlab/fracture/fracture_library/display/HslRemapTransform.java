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

import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.color.HslConversion;

import java.awt.*;

/**
 * Rescales the enabled HSL channels from their observed range onto the configured target range:
 * {@code new = base + (old - observedMin) * (targetMax - targetMin) / (observedMax - observedMin)}.
 * A degenerate observed range keeps a factor of 1. Disabled channels pass through.
 */
@Getter
@ToString
public class HslRemapTransform extends DisplayTransform {
  private final boolean remapHue, remapSaturation, remapLightness;
  private final double hueBase, hueObservedMin, hueScale;
  private final double saturationBase, saturationObservedMin, saturationScale;
  private final double lightnessBase, lightnessObservedMin, lightnessScale;

  public HslRemapTransform(final @NotNull DisplayConfig config, final @NotNull HslStatistics statistics) {
    this.remapHue = config.isHue() && statistics.hue() != null;
    this.remapSaturation = config.isSaturation() && statistics.saturation() != null;
    this.remapLightness = config.isLightness() && statistics.lightness() != null;

    if (this.remapHue) {
      // Hue on its own is offset by the minimum saturation
      final var hueOnly = !config.isSaturation() && !config.isLightness();
      this.hueBase = hueOnly ? config.getMinSaturation() : config.getMinHue();
      this.hueObservedMin = statistics.hue().min();
      this.hueScale = statistics.hue().scaleFactorTo(config.getMinHue(), config.getMaxHue());
    } else {
      this.hueBase = 0.0d;
      this.hueObservedMin = 0.0d;
      this.hueScale = 1.0d;
    }

    if (this.remapSaturation) {
      this.saturationBase = config.getMinSaturation();
      this.saturationObservedMin = statistics.saturation().min();
      this.saturationScale = statistics.saturation().scaleFactorTo(config.getMinSaturation(), config.getMaxSaturation());
    } else {
      this.saturationBase = 0.0d;
      this.saturationObservedMin = 0.0d;
      this.saturationScale = 1.0d;
    }

    if (this.remapLightness) {
      this.lightnessBase = config.getMinLightness();
      this.lightnessObservedMin = statistics.lightness().min();
      this.lightnessScale = statistics.lightness().scaleFactorTo(config.getMinLightness(), config.getMaxLightness());
    } else {
      this.lightnessBase = 0.0d;
      this.lightnessObservedMin = 0.0d;
      this.lightnessScale = 1.0d;
    }
  }

  @Override
  public @NotNull Color apply(final @NotNull Color color) {
    var hsl = HslConversion.toHsl(color);
    if (this.remapSaturation) {
      hsl = hsl.withSaturation(this.saturationBase + (hsl.saturation() - this.saturationObservedMin) * this.saturationScale);
    }
    if (this.remapLightness) {
      hsl = hsl.withLightness(this.lightnessBase + (hsl.lightness() - this.lightnessObservedMin) * this.lightnessScale);
    }
    if (this.remapHue) {
      hsl = hsl.withHue(this.hueBase + (hsl.hue() - this.hueObservedMin) * this.hueScale);
    }
    return HslConversion.toRgb(hsl, color.getAlpha());
  }
}
