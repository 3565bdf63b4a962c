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
package ru.itmo.ctlab.fracture.fracture_library.lighting;

import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.palette.Colormap;
import ru.itmo.ctlab.fracture.fracture_library.util.CommonUtils;

import java.awt.*;

public final class LightingCompositor {
  private LightingCompositor() {
  }

  private static int lightChannel(final int channel, final float light, final float ambientPower) {
    final var lit = CommonUtils.clamp((ambientPower * channel / 255.0f) + light, 0.0f, 1.0f);
    return (int) (lit * 255);
  }

  /**
   * {@code out = clamp(ambientPower * color / 255 + light, 0, 1) * 255} per channel, truncated;
   * alpha is kept.
   */
  public static @NotNull Color calculateLight(final @NotNull Color color, final @NotNull LightVector light, final float ambientPower) {
    return new Color(
      lightChannel(color.getRed(), light.x(), ambientPower),
      lightChannel(color.getGreen(), light.y(), ambientPower),
      lightChannel(color.getBlue(), light.z(), ambientPower),
      color.getAlpha()
    );
  }

  public static @NotNull Color calculateLight(final int depth, final @NotNull Colormap palette, final @NotNull LightVector light, final float ambientPower) {
    return calculateLight(palette.getColor(depth), light, ambientPower);
  }
}
