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
package ru.itmo.ctlab.fracture.fracture_library.error;

/**
 * Kinds of failures reported by the palette, image and render code.
 * None of them is retryable: the caller gets the failure as is.
 */
public enum ErrorKind {
  /**
   * Color point position outside of [0, 1].
   */
  INVALID_POSITION,
  /**
   * Palette with fewer than two colors.
   */
  INVALID_PALETTE_SIZE,
  POINT_NOT_FOUND,
  INDEX_OCCUPIED,
  /**
   * Index outside of [0, numberOfColors) or pixel coordinate outside of the image.
   */
  OUT_OF_RANGE,
  /**
   * Operation of a depth image invoked on a color image or vice versa.
   */
  MODE_MISMATCH,
  /**
   * Output buffer could not be acquired for writing.
   */
  FRAME_BUFFER_ACCESS_FAILURE
}
