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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HslTest {

  @Test
  void hueIsWrappedIntoFullTurn() {
    assertEquals(330.0d, new Hsl(-30.0d, 0.5d, 0.5d).hue(), 1e-9);
    assertEquals(0.0d, new Hsl(720.0d, 0.5d, 0.5d).hue(), 1e-9);
    assertEquals(10.0d, new Hsl(370.0d, 0.5d, 0.5d).hue(), 1e-9);
  }

  @Test
  void tinyNegativeHueDoesNotWrapToFullTurn() {
    final var hue = Hsl.wrapHue(-1e-20d);
    assertTrue(hue >= 0.0d && hue < Hsl.FULL_TURN);
  }

  @Test
  void saturationAndLightnessAreClamped() {
    final var hsl = new Hsl(0.0d, 1.5d, -0.2d);
    assertEquals(1.0d, hsl.saturation());
    assertEquals(0.0d, hsl.lightness());
  }

  @Test
  void withersKeepOtherChannels() {
    final var hsl = new Hsl(120.0d, 0.5d, 0.25d).withLightness(2.0d).withHue(-120.0d);
    assertEquals(240.0d, hsl.hue(), 1e-9);
    assertEquals(0.5d, hsl.saturation());
    assertEquals(1.0d, hsl.lightness());
  }
}
