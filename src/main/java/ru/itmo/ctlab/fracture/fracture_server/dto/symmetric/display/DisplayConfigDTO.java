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
package ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.display;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.apache.commons.lang3.ArrayUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayMode;

import java.util.Locale;

public record DisplayConfigDTO(@NotNull String mode,
                               boolean hue,
                               boolean saturation,
                               boolean lightness,
                               int @NotNull [] minRgb,
                               int @NotNull [] maxRgb,
                               double minHue,
                               double maxHue,
                               double minSaturation,
                               double maxSaturation,
                               double minLightness,
                               double maxLightness
) {
  public static @NotNull DisplayConfigDTO fromEntity(final @NotNull DisplayConfig config) {
    return new DisplayConfigDTO(
      config.getMode().name(),
      config.isHue(),
      config.isSaturation(),
      config.isLightness(),
      ArrayUtils.clone(config.getMinRgb()),
      ArrayUtils.clone(config.getMaxRgb()),
      config.getMinHue(),
      config.getMaxHue(),
      config.getMinSaturation(),
      config.getMaxSaturation(),
      config.getMinLightness(),
      config.getMaxLightness()
    );
  }

  private static int @NotNull [] toChannelArray(final @Nullable JsonArray array, final int fallback) {
    if (array == null) {
      return new int[]{fallback, fallback, fallback};
    }
    if (array.size() != DisplayConfig.CHANNEL_COUNT) {
      throw new IllegalArgumentException("Contrast bounds must have exactly " + DisplayConfig.CHANNEL_COUNT + " values, got " + array.size());
    }
    final var channels = new int[DisplayConfig.CHANNEL_COUNT];
    for (int i = 0; i < channels.length; ++i) {
      channels[i] = array.getInteger(i);
    }
    return channels;
  }

  public static @NotNull DisplayConfigDTO fromJSONObject(final @NotNull JsonObject json) {
    final var defaults = new DisplayConfig();
    return new DisplayConfigDTO(
      json.getString("mode", defaults.getMode().name()),
      json.getBoolean("hue", false),
      json.getBoolean("saturation", false),
      json.getBoolean("lightness", false),
      toChannelArray(json.getJsonArray("minRgb"), 0),
      toChannelArray(json.getJsonArray("maxRgb"), 255),
      json.getDouble("minHue", defaults.getMinHue()),
      json.getDouble("maxHue", defaults.getMaxHue()),
      json.getDouble("minSaturation", defaults.getMinSaturation()),
      json.getDouble("maxSaturation", defaults.getMaxSaturation()),
      json.getDouble("minLightness", defaults.getMinLightness()),
      json.getDouble("maxLightness", defaults.getMaxLightness())
    );
  }

  /**
   * @return validated settings: inverted pairs swapped, bounds clamped into their domains
   */
  public @NotNull DisplayConfig toEntity() {
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.valueOf(this.mode.toUpperCase(Locale.ROOT)));
    config.setHue(this.hue);
    config.setSaturation(this.saturation);
    config.setLightness(this.lightness);
    config.setMinRgb(ArrayUtils.clone(this.minRgb));
    config.setMaxRgb(ArrayUtils.clone(this.maxRgb));
    config.setMinHue(this.minHue);
    config.setMaxHue(this.maxHue);
    config.setMinSaturation(this.minSaturation);
    config.setMaxSaturation(this.maxSaturation);
    config.setMinLightness(this.minLightness);
    config.setMaxLightness(this.maxLightness);
    return config.validate();
  }
}
