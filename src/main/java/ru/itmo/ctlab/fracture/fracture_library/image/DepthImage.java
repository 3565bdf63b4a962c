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

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.ImageException;
import ru.itmo.ctlab.fracture.fracture_library.lighting.LightVector;

import java.util.Arrays;

/**
 * Palette indices in {@code [0, depth)} plus a light vector for each pixel.
 */
public final class DepthImage extends RawLightedImage {
  @Getter
  private final int depth;
  private final int @NotNull [][] pixelValues;
  private final LightVector @NotNull [][] lighting;

  public DepthImage(final int width, final int height, final int depth) {
    super(width, height);
    this.depth = Math.max(1, depth);
    this.pixelValues = new int[this.width][this.height];
    this.lighting = new LightVector[this.width][this.height];
    setAllLighting(LightVector.ZERO);
  }

  @Override
  public @NotNull ImageMode getMode() {
    return ImageMode.DEPTH;
  }

  public int getPixel(final int x, final int y) {
    checkCoordinates(x, y);
    return this.pixelValues[x][y];
  }

  public @NotNull LightVector getLighting(final int x, final int y) {
    checkCoordinates(x, y);
    return this.lighting[x][y];
  }

  public void setAllPixels(final int z) {
    checkDepth(z);
    for (final var column : this.pixelValues) {
      Arrays.fill(column, z);
    }
  }

  public void setAllLighting(final @NotNull LightVector light) {
    for (final var column : this.lighting) {
      Arrays.fill(column, light);
    }
  }

  public void setPixel(final int x, final int y, final int z, final @NotNull LightVector light) {
    checkCoordinates(x, y);
    checkDepth(z);
    this.pixelValues[x][y] = z;
    this.lighting[x][y] = light;
  }

  /**
   * Copies columns {@code pixels[0..toX-fromX]} into columns {@code fromX..toX} (inclusive).
   */
  public void setBlock(final int @NotNull [][] pixels, final LightVector @NotNull [][] light, final int fromX, final int toX, final int blockHeight, final int blockDepth) {
    checkColumnBlock(fromX, toX, blockHeight);
    if (blockDepth != this.depth) {
      throw new IllegalArgumentException("Block depth " + blockDepth + " does not match image depth " + this.depth);
    }
    final var columns = toX - fromX + 1;
    if (pixels.length < columns || light.length < columns) {
      throw new IllegalArgumentException("Block holds fewer than " + columns + " columns");
    }
    for (int i = 0; i < columns; ++i) {
      System.arraycopy(pixels[i], 0, this.pixelValues[fromX + i], 0, this.height);
      System.arraycopy(light[i], 0, this.lighting[fromX + i], 0, this.height);
    }
  }

  private void checkDepth(final int z) {
    if (z < 0 || z >= this.depth) {
      throw new ImageException(ErrorKind.OUT_OF_RANGE, "Depth value " + z + " is outside of [0, " + this.depth + ")");
    }
  }

  @Override
  public @NotNull DepthImage copy() {
    final var copied = new DepthImage(this.width, this.height, this.depth);
    for (int x = 0; x < this.width; ++x) {
      System.arraycopy(this.pixelValues[x], 0, copied.pixelValues[x], 0, this.height);
      System.arraycopy(this.lighting[x], 0, copied.lighting[x], 0, this.height);
    }
    return copied;
  }
}
