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

import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.error.ImageException;

import java.awt.*;

/**
 * Writable 32 bits per pixel raster, bytes ordered B, G, R, A, rows {@code stride} bytes apart.
 */
public interface FrameBuffer {
  int BYTES_PER_PIXEL = 4;

  int getWidth();

  int getHeight();

  int getStride();

  /**
   * Acquires exclusive write access.
   *
   * @throws ImageException with {@code FRAME_BUFFER_ACCESS_FAILURE} when the buffer cannot be acquired
   */
  @NotNull LockedFrame lock();

  interface LockedFrame extends AutoCloseable {
    /**
     * Writes the pixel at byte offset {@code stride * y + x * 4}.
     */
    void writePixel(int x, int y, @NotNull Color color);

    @Override
    void close();
  }
}
