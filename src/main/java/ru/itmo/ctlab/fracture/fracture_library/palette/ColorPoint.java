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

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.error.ColorPointException;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;

import java.awt.*;
import java.util.Locale;

/**
 * Palette anchor: a color pinned at a normalized position, where 0 maps to the first
 * palette color and 1 to the last one.
 */
@Getter(AccessLevel.PUBLIC)
@EqualsAndHashCode
@ToString
public class ColorPoint {
  @Setter(AccessLevel.PUBLIC)
  private @NotNull Color pointColor = Color.WHITE;
  private double position;

  public ColorPoint() {
  }

  public ColorPoint(final @NotNull Color pointColor, final double position) {
    this.pointColor = pointColor;
    this.setPosition(position);
  }

  public void setPosition(final double position) {
    if (!(position >= 0.0d && position <= 1.0d)) {
      throw new ColorPointException(ErrorKind.INVALID_POSITION, String.format(Locale.US, "Position value should be between zero and 1 but was: %f", position));
    }
    this.position = position;
  }

  /**
   * Color index this point maps to in a palette of {@code numberOfColors} colors.
   */
  public int colorIndexFor(final int numberOfColors) {
    if (numberOfColors < 2) {
      throw new ColorPointException(ErrorKind.INVALID_PALETTE_SIZE, "Palettes should have at least 2 colors, this one has: " + numberOfColors);
    }
    return (int) Math.floor(this.position * (numberOfColors - 1));
  }

  public void setPositionByIndex(final int index, final int numberOfColors) {
    if (numberOfColors < 2) {
      throw new ColorPointException(ErrorKind.INVALID_PALETTE_SIZE, "Palettes should have at least 2 colors, this one has: " + numberOfColors);
    }
    if (index < 0 || index >= numberOfColors) {
      throw new ColorPointException(ErrorKind.OUT_OF_RANGE, "Color index " + index + " is outside of palette with " + numberOfColors + " colors");
    }
    this.position = ((double) index) / (numberOfColors - 1);
  }

  public @NotNull ColorPoint copy() {
    return new ColorPoint(this.pointColor, this.position);
  }
}
