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
package ru.itmo.ctlab.fracture.fracture_library.lighting;

import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.palette.PaletteFactory;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class LightingCompositorTest {

  @Test
  void fullAmbientWithoutLightKeepsColor() {
    assertEquals(Color.WHITE, LightingCompositor.calculateLight(Color.WHITE, LightVector.ZERO, 1.0f));
    assertEquals(Color.BLACK, LightingCompositor.calculateLight(Color.BLACK, LightVector.ZERO, 1.0f));
  }

  @Test
  void zeroAmbientLeavesOnlyLight() {
    final var lit = LightingCompositor.calculateLight(Color.WHITE, new LightVector(0.5f, 0.25f, 1.0f), 0.0f);
    assertEquals(new Color(127, 63, 255), lit);
  }

  @Test
  void resultIsClamped() {
    assertEquals(Color.WHITE, LightingCompositor.calculateLight(Color.WHITE, new LightVector(1.0f, 1.0f, 1.0f), 1.0f));
    assertEquals(Color.BLACK, LightingCompositor.calculateLight(Color.WHITE, new LightVector(-2.0f, -2.0f, -2.0f), 1.0f));
  }

  @Test
  void alphaIsKept() {
    assertEquals(77, LightingCompositor.calculateLight(new Color(10, 20, 30, 77), LightVector.ZERO, 1.0f).getAlpha());
  }

  @Test
  void depthIsLookedUpInPalette() {
    final var palette = PaletteFactory.createTwoPinPalette(2, Color.BLACK, Color.WHITE);
    assertEquals(Color.WHITE, LightingCompositor.calculateLight(1, palette, LightVector.ZERO, 1.0f));
    assertEquals(new Color(51, 51, 51), LightingCompositor.calculateLight(0, palette, new LightVector(0.2f, 0.2f, 0.2f), 1.0f));
  }
}
