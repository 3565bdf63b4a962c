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
package ru.itmo.ctlab.fracture.fracture_library.palette;

import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.error.ColorPointException;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class ColorPointTest {

  @Test
  void defaultPointIsWhiteAtZero() {
    final var point = new ColorPoint();
    assertEquals(Color.WHITE, point.getPointColor());
    assertEquals(0.0d, point.getPosition());
  }

  @Test
  void positionOutsideUnitIntervalIsRejected() {
    final var point = new ColorPoint(Color.RED, 0.25d);
    final var e = assertThrows(ColorPointException.class, () -> point.setPosition(1.5d));
    assertEquals(ErrorKind.INVALID_POSITION, e.getKind());
    assertThrows(ColorPointException.class, () -> point.setPosition(-0.01d));
    assertThrows(ColorPointException.class, () -> point.setPosition(Double.NaN));
    assertEquals(0.25d, point.getPosition());
  }

  @Test
  void colorIndexIsFloorOfScaledPosition() {
    assertEquals(49, new ColorPoint(Color.RED, 0.5d).colorIndexFor(100));
    assertEquals(0, new ColorPoint(Color.RED, 0.0d).colorIndexFor(100));
    assertEquals(99, new ColorPoint(Color.RED, 1.0d).colorIndexFor(100));
  }

  @Test
  void colorIndexNeedsAtLeastTwoColors() {
    final var e = assertThrows(ColorPointException.class, () -> new ColorPoint(Color.RED, 0.5d).colorIndexFor(1));
    assertEquals(ErrorKind.INVALID_PALETTE_SIZE, e.getKind());
  }

  @Test
  void setPositionByIndex() {
    final var point = new ColorPoint();
    point.setPositionByIndex(25, 101);
    assertEquals(0.25d, point.getPosition(), 1e-12);

    assertEquals(ErrorKind.OUT_OF_RANGE, assertThrows(ColorPointException.class, () -> point.setPositionByIndex(101, 101)).getKind());
    assertEquals(ErrorKind.OUT_OF_RANGE, assertThrows(ColorPointException.class, () -> point.setPositionByIndex(-1, 101)).getKind());
    assertEquals(ErrorKind.INVALID_PALETTE_SIZE, assertThrows(ColorPointException.class, () -> point.setPositionByIndex(0, 1)).getKind());
    assertEquals(0.25d, point.getPosition(), 1e-12);
  }

  @Test
  void copyIsIndependent() {
    final var point = new ColorPoint(Color.BLUE, 0.5d);
    final var copy = point.copy();
    assertEquals(point, copy);
    copy.setPointColor(Color.GREEN);
    copy.setPosition(0.75d);
    assertEquals(Color.BLUE, point.getPointColor());
    assertEquals(0.5d, point.getPosition());
  }
}
