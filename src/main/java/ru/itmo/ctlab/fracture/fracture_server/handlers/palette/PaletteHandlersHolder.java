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
package ru.itmo.ctlab.fracture.fracture_server.handlers.palette;

import io.vertx.core.Vertx;
import io.vertx.core.json.Json;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.palette.Palette;
import ru.itmo.ctlab.fracture.fracture_server.HandlersHolder;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.palette.MoveColorPointRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.palette.RemoveColorPointRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.palette.SetNumberOfColorsRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.display.DisplayConfigDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.palette.ColorPointDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.symmetric.palette.PaletteDTO;
import ru.itmo.ctlab.fracture.fracture_server.util.shareable.ShareableWrappers;

import java.util.function.Consumer;

@RequiredArgsConstructor
@Slf4j
public class PaletteHandlersHolder extends HandlersHolder {
  private final Vertx vertx;

  @Override
  public void addHandlersToRouter(final @NotNull Router router) {
    router.post("/get_palette").blockingHandler(ctx -> {
      final var paletteWrapper = getPaletteWrapper(ctx);
      if (paletteWrapper == null) {
        return;
      }
      final PaletteDTO response;
      final var lock = paletteWrapper.getLock();
      try {
        lock.readLock().lock();
        response = PaletteDTO.fromEntity(paletteWrapper.getPalette());
      } finally {
        lock.readLock().unlock();
      }
      ctx.response().setStatusCode(200).end(Json.encode(response));
    });

    router.post("/set_palette").blockingHandler(ctx -> {
      final var request = PaletteDTO.fromJSONObject(ctx.body().asJsonObject());
      final var palette = request.toEntity();
      final var map = vertx.sharedData().getLocalMap("fracture_server");
      map.put("palette", new ShareableWrappers.PaletteWrapper(palette));
      log.info("Palette " + palette.getPaletteName() + " with " + palette.getNumberOfColors() + " colors and " + palette.getNumberOfColorPoints() + " pins installed");
      ctx.response().setStatusCode(200).end(Json.encode(PaletteDTO.fromEntity(palette)));
    });

    router.post("/add_color_point").blockingHandler(ctx -> {
      final var request = ColorPointDTO.fromJSONObject(ctx.body().asJsonObject());
      final var point = request.toEntity();
      editPalette(ctx, palette -> {
        if (!palette.addColorPoint(point)) {
          log.debug("Color point at position " + point.getPosition() + " was dropped since no free index was found");
        }
      });
    });

    router.post("/remove_color_point").blockingHandler(ctx -> {
      final var request = RemoveColorPointRequestDTO.fromJSONObject(ctx.body().asJsonObject());
      editPalette(ctx, palette -> palette.removeColorPoint(request.index()));
    });

    router.post("/move_color_point").blockingHandler(ctx -> {
      final var request = MoveColorPointRequestDTO.fromJSONObject(ctx.body().asJsonObject());
      editPalette(ctx, palette -> palette.moveColorPoint(request.oldIndex(), request.newIndex()));
    });

    router.post("/set_number_of_colors").blockingHandler(ctx -> {
      final var request = SetNumberOfColorsRequestDTO.fromJSONObject(ctx.body().asJsonObject());
      editPalette(ctx, palette -> palette.setNumberOfColors(request.numberOfColors()));
    });

    router.post("/spread_pins_evenly").blockingHandler(ctx -> editPalette(ctx, Palette::spreadPinsEvenly));

    router.post("/get_display_options").blockingHandler(ctx -> {
      final var map = vertx.sharedData().getLocalMap("fracture_server");
      final var configWrapper = (ShareableWrappers.DisplayConfigWrapper) map.get("displayConfig");
      if (configWrapper == null) {
        ctx.fail(new RuntimeException("Display options are not present in the local map"));
        return;
      }
      ctx.response().setStatusCode(200).end(Json.encode(DisplayConfigDTO.fromEntity(configWrapper.getDisplayConfig())));
    });

    router.post("/set_display_options").blockingHandler(ctx -> {
      final var request = DisplayConfigDTO.fromJSONObject(ctx.body().asJsonObject());
      final DisplayConfig config = request.toEntity();
      final var map = vertx.sharedData().getLocalMap("fracture_server");
      map.put("displayConfig", new ShareableWrappers.DisplayConfigWrapper(config));
      log.debug("Display options updated: " + config);
      ctx.response().setStatusCode(200).end(Json.encode(DisplayConfigDTO.fromEntity(config)));
    });
  }

  private @Nullable ShareableWrappers.PaletteWrapper getPaletteWrapper(final @NotNull RoutingContext ctx) {
    final var map = vertx.sharedData().getLocalMap("fracture_server");
    final var paletteWrapper = (ShareableWrappers.PaletteWrapper) map.get("palette");
    if (paletteWrapper == null) {
      ctx.fail(new RuntimeException("Palette is not present in the local map"));
    }
    return paletteWrapper;
  }

  private void editPalette(final @NotNull RoutingContext ctx, final @NotNull Consumer<@NotNull Palette> edit) {
    final var paletteWrapper = getPaletteWrapper(ctx);
    if (paletteWrapper == null) {
      return;
    }
    final PaletteDTO response;
    final var lock = paletteWrapper.getLock();
    try {
      lock.writeLock().lock();
      edit.accept(paletteWrapper.getPalette());
      response = PaletteDTO.fromEntity(paletteWrapper.getPalette());
    } finally {
      lock.writeLock().unlock();
    }
    ctx.response().setStatusCode(200).end(Json.encode(response));
  }
}
