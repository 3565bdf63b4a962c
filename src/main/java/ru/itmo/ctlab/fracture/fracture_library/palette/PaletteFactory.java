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

import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.PaletteException;

import java.awt.*;
import java.util.List;

public final class PaletteFactory {
  public static final @NotNull Color TURQUOISE = new Color(64, 224, 208);
  public static final @NotNull Color DARK_GREEN = new Color(0, 128, 0);

  private static final int STANDARD_PALETTE_MIN_COLORS_FOR_RAINBOW = 8;

  private PaletteFactory() {
  }

  private static void checkNumberOfColors(final int numberOfColors) {
    if (numberOfColors < 2) {
      throw new PaletteException(ErrorKind.INVALID_PALETTE_SIZE, "Cannot create a palette with less than 2 colors!");
    }
  }

  /**
   * Black to white palette; palettes of at least 8 colors also get magenta, blue, turquoise,
   * green, yellow and red spaced by 1/7 in between.
   */
  public static @NotNull Palette createStandardPalette(final int numberOfColors) {
    checkNumberOfColors(numberOfColors);
    final var palette = new Palette(numberOfColors);
    palette.addColorPoint(new ColorPoint(Color.BLACK, 0.0d));
    palette.addColorPoint(new ColorPoint(Color.WHITE, 1.0d));

    if (numberOfColors < STANDARD_PALETTE_MIN_COLORS_FOR_RAINBOW) {
      return palette;
    }

    final var subDivision = 1.0d / 7.0d;
    final var rainbow = List.of(Color.MAGENTA, Color.BLUE, TURQUOISE, DARK_GREEN, Color.YELLOW, Color.RED);
    for (int i = 0; i < rainbow.size(); ++i) {
      palette.addColorPoint(new ColorPoint(rainbow.get(i), (i + 1) * subDivision));
    }
    return palette;
  }

  public static @NotNull Palette createPaletteFromPins(final int numberOfColors, final @NotNull List<@NotNull ColorPoint> pins) {
    final var palette = new Palette(numberOfColors);
    if (pins.isEmpty()) {
      palette.addColorPoint(new ColorPoint(Color.BLACK, 0.0d));
      palette.addColorPoint(new ColorPoint(Color.WHITE, 1.0d));
      return palette;
    }
    pins.forEach(palette::addColorPoint);
    return palette;
  }

  /**
   * Palette with {@code low} at index 0 and {@code high} at the last index.
   */
  public static @NotNull Palette createTwoPinPalette(final int numberOfColors, final @NotNull Color low, final @NotNull Color high) {
    checkNumberOfColors(numberOfColors);
    final var palette = new Palette(numberOfColors);
    palette.addColorPoint(new ColorPoint(low, 0.0d));
    palette.addColorPoint(new ColorPoint(high, 1.0d));
    return palette;
  }
}
