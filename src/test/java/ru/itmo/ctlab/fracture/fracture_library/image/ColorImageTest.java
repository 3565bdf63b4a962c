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
package ru.itmo.ctlab.fracture.fracture_library.image;

import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.ImageException;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class ColorImageTest {

  @Test
  void newImageIsTransparentBlack() {
    final var image = new ColorImage(2, 3);
    assertEquals(ImageMode.COLOR, image.getMode());
    assertEquals(0, image.getPixel(1, 2).getRGB());
  }

  @Test
  void setPixel() {
    final var image = new ColorImage(2, 3);
    image.setPixel(1, 2, Color.ORANGE);
    assertEquals(Color.ORANGE, image.getPixel(1, 2));
    assertEquals(ErrorKind.OUT_OF_RANGE, assertThrows(ImageException.class, () -> image.setPixel(2, 0, Color.RED)).getKind());
  }

  @Test
  void setBlockCopiesColumns() {
    final var image = new ColorImage(3, 2);
    final Color[][] colors = {{Color.RED, Color.GREEN}};
    image.setBlock(colors, 2, 2, 2);
    assertEquals(Color.RED, image.getPixel(2, 0));
    assertEquals(Color.GREEN, image.getPixel(2, 1));
    assertEquals(0, image.getPixel(1, 0).getRGB());
    assertThrows(IllegalArgumentException.class, () -> image.setBlock(colors, 1, 2, 2));
  }

  @Test
  void depthOperationsAreRejected() {
    final RawLightedImage image = new ColorImage(1, 1);
    assertSame(image, image.asColorImage());
    assertEquals(ErrorKind.MODE_MISMATCH, assertThrows(ImageException.class, image::asDepthImage).getKind());
  }

  @Test
  void copyIsIndependent() {
    final var image = new ColorImage(1, 1);
    final var copy = image.copy();
    copy.setPixel(0, 0, Color.CYAN);
    assertEquals(0, image.getPixel(0, 0).getRGB());
  }
}
