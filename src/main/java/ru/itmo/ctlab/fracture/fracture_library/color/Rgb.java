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
package ru.itmo.ctlab.fracture.fracture_library.color;

import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.util.CommonUtils;

import java.awt.*;

/**
 * Working color with every channel clamped into [0, 1].
 */
public record Rgb(double red, double green, double blue) {
  public Rgb {
    red = CommonUtils.clamp(red, 0.0d, 1.0d);
    green = CommonUtils.clamp(green, 0.0d, 1.0d);
    blue = CommonUtils.clamp(blue, 0.0d, 1.0d);
  }

  public @NotNull Color toColor(final int alpha) {
    return new Color(
      CommonUtils.toByteChannel(this.red),
      CommonUtils.toByteChannel(this.green),
      CommonUtils.toByteChannel(this.blue),
      CommonUtils.clamp(alpha, 0, 255)
    );
  }
}
