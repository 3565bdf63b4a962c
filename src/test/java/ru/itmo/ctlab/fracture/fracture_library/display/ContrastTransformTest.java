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

import org.junit.jupiter.api.Test;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class ContrastTransformTest {

  @Test
  void fullRangeIsIdentity() {
    final var transform = new ContrastTransform(new int[]{0, 0, 0}, new int[]{255, 255, 255});
    for (final var color : new Color[]{Color.BLACK, Color.WHITE, new Color(12, 128, 250, 99), new Color(1, 254, 77)}) {
      assertEquals(color, transform.apply(color));
    }
  }

  @Test
  void slotTwoStretchesRed() {
    final var transform = new ContrastTransform(new int[]{0, 0, 100}, new int[]{255, 255, 200});

    assertEquals(new Color(255, 150, 150, 60), transform.apply(new Color(200, 150, 150, 60)));
    assertEquals(new Color(0, 150, 150), transform.apply(new Color(100, 150, 150)));
    assertEquals(new Color(0, 150, 150), transform.apply(new Color(50, 150, 150)));
    assertEquals(new Color(255, 150, 150), transform.apply(new Color(250, 150, 150)));
  }

  @Test
  void slotZeroStretchesBlue() {
    final var transform = new ContrastTransform(new int[]{0, 0, 0}, new int[]{51, 255, 255});
    assertEquals(new Color(10, 10, 255), transform.apply(new Color(10, 10, 51)));
    assertEquals(new Color(10, 10, 50), transform.apply(new Color(10, 10, 10)));
  }

  @Test
  void degenerateRangeSplitsAtMinimum() {
    final var transform = new ContrastTransform(new int[]{100, 0, 0}, new int[]{100, 255, 255});
    assertEquals(0, transform.apply(new Color(0, 0, 100)).getBlue());
    assertEquals(0, transform.apply(new Color(0, 0, 50)).getBlue());
    assertEquals(255, transform.apply(new Color(0, 0, 101)).getBlue());
  }
}
