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
package ru.itmo.ctlab.fracture.fracture_server.dto.request.render;

import io.vertx.core.json.JsonObject;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.image.ColorImage;

import java.awt.*;

/**
 * Color raster given as columns of packed ARGB integers, {@code colors[x][y]}.
 */
public record ColorRenderRequestDTO(int width, int height, int @NotNull [][] colors) {
  public static @NotNull ColorRenderRequestDTO fromJSONObject(final @NotNull JsonObject json) {
    final int width = json.getInteger("width");
    final int height = json.getInteger("height");
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Color render request must be at least 1x1, got " + width + "x" + height);
    }
    final var columns = json.getJsonArray("colors");
    if (columns == null || columns.size() != width) {
      throw new IllegalArgumentException("Color render request must contain " + width + " color columns");
    }
    final var colors = new int[width][height];
    for (int x = 0; x < width; ++x) {
      final var column = columns.getJsonArray(x);
      if (column == null || column.size() != height) {
        throw new IllegalArgumentException("Column " + x + " must contain " + height + " values");
      }
      for (int y = 0; y < height; ++y) {
        colors[x][y] = column.getLong(y).intValue();
      }
    }
    return new ColorRenderRequestDTO(width, height, colors);
  }

  public @NotNull ColorImage toEntity() {
    final var image = new ColorImage(this.width, this.height);
    for (int x = 0; x < this.width; ++x) {
      for (int y = 0; y < this.height; ++y) {
        image.setPixel(x, y, new Color(this.colors[x][y], true));
      }
    }
    return image;
  }
}
