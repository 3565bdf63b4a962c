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

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.apache.commons.lang3.ArrayUtils;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.util.CommonUtils;

/**
 * Settings of the display transform applied between palette lookup and lighting.
 * <p>
 * {@code minRgb}/{@code maxRgb} hold contrast bounds for channel slots 0, 1, 2; slot 0
 * stretches blue, slot 1 green and slot 2 red.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class DisplayConfig {
  public static final double MAX_HUE = 359.9d;
  public static final double IDEAL_MAX_HUE = 300.0d;
  public static final int CHANNEL_COUNT = 3;

  private @NotNull DisplayMode mode = DisplayMode.OFF;
  private boolean hue;
  private boolean saturation;
  private boolean lightness;
  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private int @NotNull [] minRgb = new int[]{0, 0, 0};
  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private int @NotNull [] maxRgb = new int[]{255, 255, 255};
  private double minHue = 0.0d;
  private double maxHue = IDEAL_MAX_HUE;
  private double minSaturation = 0.0d;
  private double maxSaturation = 1.0d;
  private double minLightness = 0.0d;
  private double maxLightness = 1.0d;

  public int @NotNull [] getMinRgb() {
    return ArrayUtils.clone(this.minRgb);
  }

  public void setMinRgb(final int @NotNull [] minRgb) {
    this.minRgb = ArrayUtils.clone(minRgb);
  }

  public int @NotNull [] getMaxRgb() {
    return ArrayUtils.clone(this.maxRgb);
  }

  public void setMaxRgb(final int @NotNull [] maxRgb) {
    this.maxRgb = ArrayUtils.clone(maxRgb);
  }

  public boolean isAnyHslChannelEnabled() {
    return this.hue || this.saturation || this.lightness;
  }

  /**
   * Clamps every bound into its domain, then swaps inverted min/max pairs.
   */
  public @NotNull DisplayConfig validate() {
    if (this.minRgb.length != CHANNEL_COUNT || this.maxRgb.length != CHANNEL_COUNT) {
      throw new IllegalArgumentException("Contrast bounds must have exactly " + CHANNEL_COUNT + " channels");
    }
    for (int i = 0; i < CHANNEL_COUNT; ++i) {
      this.minRgb[i] = CommonUtils.clamp(this.minRgb[i], 0, 255);
      this.maxRgb[i] = CommonUtils.clamp(this.maxRgb[i], 0, 255);
      if (this.minRgb[i] > this.maxRgb[i]) {
        final var t = this.minRgb[i];
        this.minRgb[i] = this.maxRgb[i];
        this.maxRgb[i] = t;
      }
    }

    this.minHue = CommonUtils.clamp(this.minHue, 0.0d, MAX_HUE);
    this.maxHue = CommonUtils.clamp(this.maxHue, 0.0d, MAX_HUE);
    if (this.minHue > this.maxHue) {
      final var t = this.minHue;
      this.minHue = this.maxHue;
      this.maxHue = t;
    }

    this.minSaturation = CommonUtils.clamp(this.minSaturation, 0.0d, 1.0d);
    this.maxSaturation = CommonUtils.clamp(this.maxSaturation, 0.0d, 1.0d);
    if (this.minSaturation > this.maxSaturation) {
      final var t = this.minSaturation;
      this.minSaturation = this.maxSaturation;
      this.maxSaturation = t;
    }

    this.minLightness = CommonUtils.clamp(this.minLightness, 0.0d, 1.0d);
    this.maxLightness = CommonUtils.clamp(this.maxLightness, 0.0d, 1.0d);
    if (this.minLightness > this.maxLightness) {
      final var t = this.minLightness;
      this.minLightness = this.maxLightness;
      this.maxLightness = t;
    }
    return this;
  }

  public void resetContrast() {
    for (int i = 0; i < CHANNEL_COUNT; ++i) {
      this.minRgb[i] = 0;
      this.maxRgb[i] = 255;
    }
  }

  public void resetHsl() {
    this.minHue = 0.0d;
    this.maxHue = MAX_HUE;
    this.minSaturation = 0.0d;
    this.maxSaturation = 1.0d;
    this.minLightness = 0.0d;
    this.maxLightness = 1.0d;
  }

  public @NotNull DisplayConfig copy() {
    final var copy = new DisplayConfig();
    copy.mode = this.mode;
    copy.hue = this.hue;
    copy.saturation = this.saturation;
    copy.lightness = this.lightness;
    copy.minRgb = ArrayUtils.clone(this.minRgb);
    copy.maxRgb = ArrayUtils.clone(this.maxRgb);
    copy.minHue = this.minHue;
    copy.maxHue = this.maxHue;
    copy.minSaturation = this.minSaturation;
    copy.maxSaturation = this.maxSaturation;
    copy.minLightness = this.minLightness;
    copy.maxLightness = this.maxLightness;
    return copy;
  }
}
