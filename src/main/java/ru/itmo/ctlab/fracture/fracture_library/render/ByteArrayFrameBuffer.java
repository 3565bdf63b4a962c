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
package ru.itmo.ctlab.fracture.fracture_library.render;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.ImageException;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.util.concurrent.atomic.AtomicBoolean;

@Getter
public class ByteArrayFrameBuffer implements FrameBuffer {
  private final int width;
  private final int height;
  private final int stride;
  private final byte @NotNull [] data;
  @Getter(lombok.AccessLevel.NONE)
  private final AtomicBoolean locked = new AtomicBoolean(false);

  public ByteArrayFrameBuffer(final int width, final int height) {
    this(width, height, width * BYTES_PER_PIXEL);
  }

  public ByteArrayFrameBuffer(final int width, final int height, final int stride) {
    this(width, height, stride, new byte[Math.max(0, stride * height)]);
  }

  public ByteArrayFrameBuffer(final int width, final int height, final int stride, final byte @NotNull [] data) {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Frame buffer must be at least 1x1, requested " + width + "x" + height);
    }
    if (stride < width * BYTES_PER_PIXEL) {
      throw new IllegalArgumentException("Stride " + stride + " is less than " + (width * BYTES_PER_PIXEL) + " bytes of a row");
    }
    this.width = width;
    this.height = height;
    this.stride = stride;
    this.data = data;
  }

  public boolean isLocked() {
    return this.locked.get();
  }

  @Override
  public @NotNull LockedFrame lock() {
    if ((long) this.stride * (this.height - 1) + (long) this.width * BYTES_PER_PIXEL > this.data.length) {
      throw new ImageException(ErrorKind.FRAME_BUFFER_ACCESS_FAILURE, "Backing array of " + this.data.length + " bytes cannot hold a " + this.width + "x" + this.height + " frame with stride " + this.stride);
    }
    if (!this.locked.compareAndSet(false, true)) {
      throw new ImageException(ErrorKind.FRAME_BUFFER_ACCESS_FAILURE, "Frame buffer is already locked for writing");
    }
    return new LockedFrame() {
      @Override
      public void writePixel(final int x, final int y, final @NotNull Color color) {
        final var pos = stride * y + x * BYTES_PER_PIXEL;
        data[pos] = (byte) color.getBlue();
        data[pos + 1] = (byte) color.getGreen();
        data[pos + 2] = (byte) color.getRed();
        data[pos + 3] = (byte) color.getAlpha();
      }

      @Override
      public void close() {
        locked.set(false);
      }
    };
  }

  /**
   * Color of the pixel as currently stored in the buffer.
   */
  public @NotNull Color getPixel(final int x, final int y) {
    final var pos = this.stride * y + x * BYTES_PER_PIXEL;
    return new Color(
      Byte.toUnsignedInt(this.data[pos + 2]),
      Byte.toUnsignedInt(this.data[pos + 1]),
      Byte.toUnsignedInt(this.data[pos]),
      Byte.toUnsignedInt(this.data[pos + 3])
    );
  }

  /**
   * AWT view sharing the backing array; later renders into this buffer show up in the image.
   */
  public @NotNull BufferedImage toBufferedImage() {
    final DataBuffer buffer = new DataBufferByte(this.data, this.data.length);
    final WritableRaster raster = Raster.createInterleavedRaster(buffer, this.width, this.height, this.stride, BYTES_PER_PIXEL, new int[]{2, 1, 0, 3}, null);
    final ColorModel cm = new ComponentColorModel(ColorModel.getRGBdefault().getColorSpace(), true, false, Transparency.TRANSLUCENT, DataBuffer.TYPE_BYTE);
    return new BufferedImage(cm, raster, false, null);
  }
}
