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

import org.jetbrains.annotations.NotNull;

import java.awt.*;
import java.util.Arrays;

/**
 * Precomputed colors; rendered without palette lookup or lighting.
 */
public final class ColorImage extends RawLightedImage {
  private static final Color TRANSPARENT_BLACK = new Color(0, 0, 0, 0);

  private final Color @NotNull [][] colorValues;

  public ColorImage(final int width, final int height) {
    super(width, height);
    this.colorValues = new Color[this.width][this.height];
    for (final var column : this.colorValues) {
      Arrays.fill(column, TRANSPARENT_BLACK);
    }
  }

  @Override
  public @NotNull ImageMode getMode() {
    return ImageMode.COLOR;
  }

  public @NotNull Color getPixel(final int x, final int y) {
    checkCoordinates(x, y);
    return this.colorValues[x][y];
  }

  public void setPixel(final int x, final int y, final @NotNull Color color) {
    checkCoordinates(x, y);
    this.colorValues[x][y] = color;
  }

  /**
   * Copies columns {@code colors[0..toX-fromX]} into columns {@code fromX..toX} (inclusive).
   */
  public void setBlock(final Color @NotNull [][] colors, final int fromX, final int toX, final int blockHeight) {
    checkColumnBlock(fromX, toX, blockHeight);
    final var columns = toX - fromX + 1;
    if (colors.length < columns) {
      throw new IllegalArgumentException("Block holds fewer than " + columns + " columns");
    }
    for (int i = 0; i < columns; ++i) {
      System.arraycopy(colors[i], 0, this.colorValues[fromX + i], 0, this.height);
    }
  }

  @Override
  public @NotNull ColorImage copy() {
    final var copied = new ColorImage(this.width, this.height);
    for (int x = 0; x < this.width; ++x) {
      System.arraycopy(this.colorValues[x], 0, copied.colorValues[x], 0, this.height);
    }
    return copied;
  }
}
