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
package ru.itmo.ctlab.fracture.fracture_server.dto;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayMode;
import ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.display.DisplayConfigDTO;

import static org.junit.jupiter.api.Assertions.*;

class DisplayConfigDTOTest {

  @Test
  void loadedSettingsAreValidated() {
    final var json = new JsonObject()
      .put("mode", "contrast")
      .put("minRgb", new JsonArray().add(200).add(0).add(0))
      .put("maxRgb", new JsonArray().add(100).add(255).add(300))
      .put("minSaturation", 0.9d)
      .put("maxSaturation", 0.1d);

    final var config = DisplayConfigDTO.fromJSONObject(json).toEntity();

    assertEquals(DisplayMode.CONTRAST, config.getMode());
    assertArrayEquals(new int[]{100, 0, 0}, config.getMinRgb());
    assertArrayEquals(new int[]{200, 255, 255}, config.getMaxRgb());
    assertEquals(0.1d, config.getMinSaturation());
    assertEquals(0.9d, config.getMaxSaturation());
  }

  @Test
  void missingFieldsFallBackToDefaults() {
    assertEquals(new DisplayConfig(), DisplayConfigDTO.fromJSONObject(new JsonObject()).toEntity());
  }

  @Test
  void wrongChannelCountIsRejected() {
    final var json = new JsonObject().put("minRgb", new JsonArray().add(1).add(2));
    assertThrows(IllegalArgumentException.class, () -> DisplayConfigDTO.fromJSONObject(json));
  }

  @Test
  void unknownModeIsRejected() {
    final var json = new JsonObject().put("mode", "sepia");
    assertThrows(IllegalArgumentException.class, () -> DisplayConfigDTO.fromJSONObject(json).toEntity());
  }

  @Test
  void entityRoundTrip() {
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.HSL);
    config.setHue(true);
    config.setMinHue(20.0d);
    assertEquals(config, DisplayConfigDTO.fromEntity(config).toEntity());
  }
}
