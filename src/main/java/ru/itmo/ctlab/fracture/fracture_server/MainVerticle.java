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
package ru.itmo.ctlab.fracture.fracture_server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.logging.SLF4JLogDelegateFactory;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.error.FractureException;
import ru.itmo.ctlab.fracture.fracture_library.palette.PaletteFactory;
import ru.itmo.ctlab.fracture.fracture_server.handlers.palette.PaletteHandlersHolder;
import ru.itmo.ctlab.fracture.fracture_server.handlers.render.RenderHandlersHolder;
import ru.itmo.ctlab.fracture.fracture_server.util.shareable.ShareableWrappers;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class MainVerticle extends AbstractVerticle {

  public static void main(final String[] args) {
    Vertx.vertx().deployVerticle(new MainVerticle());
  }

  @Override
  public void start(final Promise<Void> startPromise) {
    // set vertx logger delegate factory to slf4j
    String logFactory = System.getProperty("org.vertx.logger-delegate-factory-class-name");
    if (logFactory == null) {
      System.setProperty("org.vertx.logger-delegate-factory-class-name", SLF4JLogDelegateFactory.class.getName());
    }

    final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.INFO);

    log.info("Logging initialized");

    final ConfigStoreOptions jsonEnvConfig = new ConfigStoreOptions().setType("env")
      .setConfig(new JsonObject().put("keys", new JsonArray().add("VXPORT").add("PALETTE_COLORS").add("AMBIENT_POWER").add("RENDER_PARALLEL")));
    final ConfigRetrieverOptions options = new ConfigRetrieverOptions().addStore(jsonEnvConfig);
    final ConfigRetriever configRetriever = ConfigRetriever.create(vertx, options);

    configRetriever.getConfig()
      .onFailure(startPromise::fail)
      .onSuccess(config -> {
        final int port = writeConfigurationToLocalMap(config);
        startServer(port, startPromise);
      });
  }

  private int writeConfigurationToLocalMap(final @NotNull JsonObject config) {
    final var port = config.getInteger("VXPORT", 5000);
    final var paletteColors = config.getInteger("PALETTE_COLORS", 256);
    final var ambientPower = config.getDouble("AMBIENT_POWER", 1.0d).floatValue();
    final var renderParallel = config.getBoolean("RENDER_PARALLEL", true);

    try {
      log.info("Trying to write configuration to local map");
      final var map = vertx.sharedData().getLocalMap("fracture_server");
      map.put("VXPORT", port);
      map.put("ambientPower", ambientPower);
      map.put("renderParallel", renderParallel);
      map.put("palette", new ShareableWrappers.PaletteWrapper(PaletteFactory.createStandardPalette(paletteColors)));
      map.put("displayConfig", new ShareableWrappers.DisplayConfigWrapper(new DisplayConfig()));
      log.info("Added to local map");
    } finally {
      log.info("Finished configuration write to maps");
    }

    log.info("Using standard palette with " + paletteColors + " colors");
    log.info("Using ambient power " + ambientPower + ", parallel rendering: " + renderParallel);
    log.info("Server will start on port " + port);
    return port;
  }

  private void startServer(final int port, final @NotNull Promise<Void> startPromise) {
    final HttpServerOptions serverOptions = new HttpServerOptions();
    serverOptions.setCompressionSupported(true);
    final var server = vertx.createHttpServer(serverOptions);
    final var router = Router.router(vertx);

    router.route().handler(CorsHandler.create()
      .allowedMethod(io.vertx.core.http.HttpMethod.GET)
      .allowedMethod(io.vertx.core.http.HttpMethod.POST)
      .allowedMethod(io.vertx.core.http.HttpMethod.OPTIONS)
      .allowedHeader("Access-Control-Request-Method")
      .allowedHeader("Access-Control-Allow-Credentials")
      .allowedHeader("Access-Control-Allow-Origin")
      .allowedHeader("Access-Control-Allow-Headers")
      .allowedHeader("Content-Type"));
    router.route().handler(BodyHandler.create());
    vertx.exceptionHandler(event -> {
      log.error("An exception was caught at the top level", event);
      log.debug(event.getMessage());
    });

    log.info("Initializing handlers");
    final List<HandlersHolder> handlersHolders = new ArrayList<>();
    handlersHolders.add(new PaletteHandlersHolder(vertx));
    handlersHolders.add(new RenderHandlersHolder(vertx));

    router.route().failureHandler(MainVerticle::handleFailure);

    log.info("Configuring router");
    handlersHolders.forEach(handlersHolder -> handlersHolder.addHandlersToRouter(router));

    log.info("Starting server on port " + port);
    server.requestHandler(router).listen(port)
      .onSuccess(httpServer -> {
        log.info("Server started");
        startPromise.complete();
      })
      .onFailure(startPromise::fail);
  }

  private static void handleFailure(final @NotNull RoutingContext ctx) {
    final var failure = ctx.failure();
    if (failure == null) {
      ctx.response().setStatusCode(ctx.statusCode() > 0 ? ctx.statusCode() : 500).end();
      return;
    }
    final int statusCode;
    if (failure instanceof FractureException fractureException) {
      log.debug("Request failed with " + fractureException.getKind() + ": " + failure.getMessage());
      statusCode = 400;
    } else if (failure instanceof IllegalArgumentException || failure instanceof ClassCastException || failure instanceof NullPointerException) {
      log.debug("Malformed request: " + failure.getMessage());
      statusCode = 400;
    } else {
      log.error("Request failed", failure);
      statusCode = 500;
    }
    ctx.response().setStatusCode(statusCode).putHeader("Content-Type", "text/plain").end(String.valueOf(failure.getMessage()));
  }
}
