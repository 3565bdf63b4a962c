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

import ru.itmo.ctlab.fracture.fracture_library.util.CommonUtils;

/**
 * Hue in degrees wrapped into [0, 360), saturation and lightness clamped into [0, 1].
 */
public record Hsl(double hue, double saturation, double lightness) {
  public static final double FULL_TURN = 360.0d;

  public Hsl {
    hue = wrapHue(hue);
    saturation = CommonUtils.clamp(saturation, 0.0d, 1.0d);
    lightness = CommonUtils.clamp(lightness, 0.0d, 1.0d);
  }

  public static double wrapHue(final double degrees) {
    var h = degrees % FULL_TURN;
    if (h < 0.0d) {
      h += FULL_TURN;
    }
    // -tiny + 360.0 rounds up to 360.0
    if (h >= FULL_TURN) {
      h -= FULL_TURN;
    }
    return h;
  }

  public Hsl withHue(final double hue) {
    return new Hsl(hue, this.saturation, this.lightness);
  }

  public Hsl withSaturation(final double saturation) {
    return new Hsl(this.hue, saturation, this.lightness);
  }

  public Hsl withLightness(final double lightness) {
    return new Hsl(this.hue, this.saturation, lightness);
  }
}
