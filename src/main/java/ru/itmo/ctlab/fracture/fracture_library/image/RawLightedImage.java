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

/**
 * Raster waiting to be rendered: either palette indices with per-pixel lighting
 * ({@link DepthImage}) or final colors ({@link ColorImage}). Pixels are addressed as {@code [x][y]}.
 */
@Getter
public abstract sealed class RawLightedImage permits DepthImage, ColorImage {
  protected final int width;
  protected final int height;

  protected RawLightedImage(final int width, final int height) {
    this.width = Math.max(1, width);
    this.height = Math.max(1, height);
  }

  public abstract @NotNull ImageMode getMode();

  public abstract @NotNull RawLightedImage copy();

  public @NotNull DepthImage asDepthImage() {
    if (this instanceof DepthImage depthImage) {
      return depthImage;
    }
    throw new ImageException(ErrorKind.MODE_MISMATCH, "Image is in " + getMode() + " mode, depth mode operation is not applicable");
  }

  public @NotNull ColorImage asColorImage() {
    if (this instanceof ColorImage colorImage) {
      return colorImage;
    }
    throw new ImageException(ErrorKind.MODE_MISMATCH, "Image is in " + getMode() + " mode, color mode operation is not applicable");
  }

  protected void checkCoordinates(final int x, final int y) {
    if (x < 0 || x >= this.width || y < 0 || y >= this.height) {
      throw new ImageException(ErrorKind.OUT_OF_RANGE, String.format("Pixel (%d, %d) is outside of %dx%d image", x, y, this.width, this.height));
    }
  }

  protected void checkColumnBlock(final int fromX, final int toX, final int blockHeight) {
    if (blockHeight != this.height) {
      throw new IllegalArgumentException("Block height " + blockHeight + " does not match image height " + this.height);
    }
    if (fromX < 0 || fromX >= this.width) {
      throw new IllegalArgumentException("Block start column " + fromX + " is outside of image width " + this.width);
    }
    if (toX < fromX || toX >= this.width) {
      throw new IllegalArgumentException("Block end column " + toX + " must be in [" + fromX + ", " + this.width + ")");
    }
  }
}
