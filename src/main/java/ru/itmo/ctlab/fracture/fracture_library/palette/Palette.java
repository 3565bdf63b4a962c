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

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.PaletteException;

import java.awt.*;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ordered set of {@link ColorPoint}s keyed by their color index. Colors between two points
 * are linearly interpolated, colors outside of the first/last point take that point's color.
 * <p>
 * Points are always stored and handed out as copies. The palette is not thread-safe: edits
 * must not overlap with each other or with renders that read the palette.
 */
@Slf4j
public class Palette extends Colormap {
  public static final @NotNull String DEFAULT_NAME = "Default";

  private @NotNull NavigableMap<@NotNull Integer, @NotNull ColorPoint> colorPoints = new TreeMap<>();
  @Getter
  private int numberOfColors;
  @Getter
  @Setter
  private @NotNull String paletteName;

  public Palette(final int numberOfColors) {
    this(numberOfColors, DEFAULT_NAME);
  }

  public Palette(final int numberOfColors, final @NotNull String paletteName) {
    checkNumberOfColors(numberOfColors);
    this.numberOfColors = numberOfColors;
    this.paletteName = paletteName;
  }

  private static void checkNumberOfColors(final int numberOfColors) {
    if (numberOfColors < 2) {
      throw new PaletteException(ErrorKind.INVALID_PALETTE_SIZE, "Cannot create a palette with less than 2 colors, requested: " + numberOfColors);
    }
  }

  /**
   * Changes the number of colors and moves every point to the index its position maps to
   * under the new count.
   */
  public void setNumberOfColors(final int numberOfColors) {
    checkNumberOfColors(numberOfColors);
    this.numberOfColors = numberOfColors;
    final var redistributed = new TreeMap<Integer, ColorPoint>();
    for (final var point : this.colorPoints.values()) {
      tryToAddPoint(point.colorIndexFor(numberOfColors), point, redistributed);
    }
    if (redistributed.size() < this.colorPoints.size()) {
      log.debug("Palette " + this.paletteName + " lost " + (this.colorPoints.size() - redistributed.size()) + " color points while redistributing to " + numberOfColors + " colors");
    }
    this.colorPoints = redistributed;
  }

  /**
   * Inserts the point at {@code index}. An occupied index moves the point one step toward the
   * interior (down from the last index, up from any other index); if that slot is occupied too,
   * the point is dropped.
   *
   * @return whether the point was inserted
   */
  private boolean tryToAddPoint(final int index, final @NotNull ColorPoint point, final @NotNull NavigableMap<Integer, ColorPoint> target) {
    if (!target.containsKey(index)) {
      target.put(index, point);
      return true;
    }
    final var shiftedIndex = (index == this.numberOfColors - 1) ? (index - 1) : (index + 1);
    if (target.containsKey(shiftedIndex)) {
      log.debug("Dropping color point " + point + ": both index " + index + " and " + shiftedIndex + " are occupied");
      return false;
    }
    point.setPositionByIndex(shiftedIndex, this.numberOfColors);
    target.put(shiftedIndex, point);
    return true;
  }

  @Override
  public @NotNull Color getColor(final int index) {
    final var exact = this.colorPoints.get(index);
    if (exact != null) {
      return exact.getPointColor();
    }

    final var low = this.colorPoints.lowerEntry(index);
    final var high = this.colorPoints.higherEntry(index);

    if (low == null && high == null) {
      return Color.WHITE;
    } else if (low == null) {
      return high.getValue().getPointColor();
    } else if (high == null) {
      return low.getValue().getPointColor();
    }
    return interpolate(index, low, high);
  }

  private static @NotNull Color interpolate(final int index, final @NotNull Map.Entry<Integer, ColorPoint> low, final @NotNull Map.Entry<Integer, ColorPoint> high) {
    final int delta = high.getKey() - low.getKey();
    final int distanceFromLow = index - low.getKey();

    final double highWeight = ((double) distanceFromLow) / delta;
    final double lowWeight = 1.0d - highWeight;

    final var lowColor = low.getValue().getPointColor();
    final var highColor = high.getValue().getPointColor();

    return new Color(
      (int) (lowWeight * lowColor.getRed() + highWeight * highColor.getRed()),
      (int) (lowWeight * lowColor.getGreen() + highWeight * highColor.getGreen()),
      (int) (lowWeight * lowColor.getBlue() + highWeight * highColor.getBlue()),
      (int) (lowWeight * lowColor.getAlpha() + highWeight * highColor.getAlpha())
    );
  }

  public int getNumberOfColorPoints() {
    return this.colorPoints.size();
  }

  /**
   * @return copy of the point at exactly this index or {@code null} when there is none
   */
  public @Nullable ColorPoint getColorPoint(final int index) {
    final var point = this.colorPoints.get(index);
    return (point == null) ? null : point.copy();
  }

  public boolean isPointAtIndex(final int index) {
    return this.colorPoints.containsKey(index);
  }

  /**
   * Adds a copy of the point at the index derived from its position.
   *
   * @return whether the point found a free slot
   */
  public boolean addColorPoint(final @NotNull ColorPoint colorPoint) {
    final var copied = colorPoint.copy();
    return tryToAddPoint(copied.colorIndexFor(this.numberOfColors), copied, this.colorPoints);
  }

  public void removeColorPoint(final int index) {
    if (this.colorPoints.remove(index) == null) {
      throw new PaletteException(ErrorKind.POINT_NOT_FOUND, "Cannot remove color point that doesn't exist at index: " + index);
    }
  }

  public void moveColorPoint(final int oldIndex, final int newIndex) {
    if (oldIndex < 0 || oldIndex >= this.numberOfColors) {
      throw new PaletteException(ErrorKind.OUT_OF_RANGE, "Old index " + oldIndex + " is out of range [0, " + this.numberOfColors + ")");
    }
    if (newIndex < 0 || newIndex >= this.numberOfColors) {
      throw new PaletteException(ErrorKind.OUT_OF_RANGE, "New index " + newIndex + " is out of range [0, " + this.numberOfColors + ")");
    }
    if (isPointAtIndex(newIndex)) {
      throw new PaletteException(ErrorKind.INDEX_OCCUPIED, "Cannot move color point to an occupied index: " + newIndex);
    }
    if (!isPointAtIndex(oldIndex)) {
      throw new PaletteException(ErrorKind.POINT_NOT_FOUND, "Cannot move color point that doesn't exist at index: " + oldIndex);
    }

    final var moved = this.colorPoints.remove(oldIndex).copy();
    moved.setPositionByIndex(newIndex, this.numberOfColors);
    tryToAddPoint(newIndex, moved, this.colorPoints);
  }

  public @NotNull SortedMap<@NotNull Integer, @NotNull ColorPoint> getCopyOfColorPointList() {
    final var copy = new TreeMap<Integer, ColorPoint>();
    this.colorPoints.forEach((index, point) -> copy.put(index, point.copy()));
    return copy;
  }

  /**
   * Pins the first point to index 0, the last one to the last index and spaces the points
   * in between evenly, keeping their order.
   */
  public void spreadPinsEvenly() {
    final var pinCount = this.colorPoints.size();
    if (pinCount == 0) {
      return;
    }
    final var spacing = ((double) this.numberOfColors) / (pinCount - 1);
    final var spread = new TreeMap<Integer, ColorPoint>();

    var order = 0;
    for (final var point : this.colorPoints.values()) {
      final int newIndex;
      if (order == 0) {
        newIndex = 0;
      } else if (order == pinCount - 1) {
        newIndex = this.numberOfColors - 1;
      } else {
        newIndex = (int) (order * spacing + 0.5d) - 1;
      }
      final var copied = point.copy();
      copied.setPositionByIndex(newIndex, this.numberOfColors);
      tryToAddPoint(newIndex, copied, spread);
      ++order;
    }

    this.colorPoints = spread;
  }

  public @NotNull Palette copy() {
    final var copied = new Palette(this.numberOfColors, this.paletteName);
    this.colorPoints.forEach((index, point) -> copied.colorPoints.put(index, point.copy()));
    return copied;
  }
}
