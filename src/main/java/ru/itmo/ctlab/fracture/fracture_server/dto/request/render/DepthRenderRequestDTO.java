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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.image.DepthImage;
import ru.itmo.ctlab.fracture.fracture_library.lighting.LightVector;

/**
 * Depth raster given as columns: {@code pixels[x][y]} and optional {@code lighting[x][y] = [lx, ly, lz]}.
 * A missing ambient power falls back to the server default.
 */
public record DepthRenderRequestDTO(int width, int height, int @NotNull [][] pixels,
                                    LightVector @Nullable [][] lighting, @Nullable Float ambientPower) {

  public static @NotNull DepthRenderRequestDTO fromJSONObject(final @NotNull JsonObject json) {
    final int width = json.getInteger("width");
    final int height = json.getInteger("height");
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Depth render request must be at least 1x1, got " + width + "x" + height);
    }
    final var pixelColumns = json.getJsonArray("pixels");
    if (pixelColumns == null || pixelColumns.size() != width) {
      throw new IllegalArgumentException("Depth render request must contain " + width + " pixel columns");
    }
    final var pixels = new int[width][height];
    for (int x = 0; x < width; ++x) {
      final var column = pixelColumns.getJsonArray(x);
      checkColumn(column, x, height);
      for (int y = 0; y < height; ++y) {
        pixels[x][y] = column.getInteger(y);
      }
    }

    final var lightColumns = json.getJsonArray("lighting");
    LightVector[][] lighting = null;
    if (lightColumns != null) {
      if (lightColumns.size() != width) {
        throw new IllegalArgumentException("Depth render request must contain " + width + " lighting columns");
      }
      lighting = new LightVector[width][height];
      for (int x = 0; x < width; ++x) {
        final var column = lightColumns.getJsonArray(x);
        checkColumn(column, x, height);
        for (int y = 0; y < height; ++y) {
          final var v = column.getJsonArray(y);
          lighting[x][y] = new LightVector(v.getFloat(0), v.getFloat(1), v.getFloat(2));
        }
      }
    }

    return new DepthRenderRequestDTO(width, height, pixels, lighting, json.getFloat("ambientPower"));
  }

  private static void checkColumn(final @Nullable JsonArray column, final int x, final int height) {
    if (column == null || column.size() != height) {
      throw new IllegalArgumentException("Column " + x + " must contain " + height + " values");
    }
  }

  public @NotNull DepthImage toEntity(final int depth) {
    final var image = new DepthImage(this.width, this.height, depth);
    for (int x = 0; x < this.width; ++x) {
      for (int y = 0; y < this.height; ++y) {
        image.setPixel(x, y, this.pixels[x][y], (this.lighting == null) ? LightVector.ZERO : this.lighting[x][y]);
      }
    }
    return image;
  }
}
