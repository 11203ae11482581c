package io.tunnelcontrol.server.gateway;

import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HttpResponseException;
import io.tunnelcontrol.core.control.ConnectionOrchestrator;
import io.tunnelcontrol.core.identity.CertificateDetails;
import io.tunnelcontrol.core.identity.CertificateMaterial;
import io.tunnelcontrol.core.identity.TlsIdentityManager;
import io.tunnelcontrol.core.settings.ServerRuntimeSettings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The control API: a Javalin server exposing health, connect, disconnect, status and the Swagger
 * page.
 *
 * <p>
 * Request pipeline:
 * <ol>
 * <li>request logger (method, path, status, latency)</li>
 * <li>{@link CorsHandler}: wildcard origin, preflight short-circuit</li>
 * <li>{@link AuthHandler}: bearer token, only when auth is enabled</li>
 * <li>route handler from {@link ApiRoute#ALL}, JSON by default</li>
 * </ol>
 *
 * <p>
 * The gateway is started and stopped as a whole; changing port, HTTPS or auth means
 * {@link #restart(ServerRuntimeSettings)}. Certificate material is produced here, at start, never
 * inside a request.
 */
public final class ControlGateway {

    private static final Logger LOG = LoggerFactory.getLogger(ControlGateway.class);

    private final String bindHost;
    private final ConnectionOrchestrator orchestrator;
    private final TlsIdentityManager identityManager;

    private Javalin app;
    private ServerRuntimeSettings active;

    public ControlGateway(String bindHost, ConnectionOrchestrator orchestrator, TlsIdentityManager identityManager) {
        this.bindHost = bindHost;
        this.orchestrator = orchestrator;
        this.identityManager = identityManager;
    }

    /**
     * Starts serving with {@code settings}. A no-op when already running.
     *
     * @throws IllegalStateException if auth is enabled without a token
     * @throws io.javalin.util.JavalinBindException if the port is taken
     */
    public synchronized void start(ServerRuntimeSettings settings) {
        if (app != null) {
            LOG.info("Control API already running on {}", address());
            return;
        }
        if (settings.authEnabled() && (settings.token() == null || settings.token().isEmpty())) {
            throw new IllegalStateException("Authentication is enabled but no token is configured");
        }

        CertificateMaterial material = settings.httpsEnabled() ? loadIdentity() : null;
        Map<String, Handler> handlers = routeHandlers();

        Javalin created = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.http.defaultContentType = "application/json";
            cfg.requestLogger.http((ctx, ms) -> LOG.info(
                    "{} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), Math.round(ms)));
            if (material != null) {
                TlsConfigurator.configureHttps(cfg, material, bindHost, settings.port());
            }
        });

        created.before(new CorsHandler());
        if (settings.authEnabled()) {
            created.before(new AuthHandler(settings.token()));
        }
        for (ApiRoute route : ApiRoute.ALL) {
            created.addHttpHandler(route.method(), route.path(), handlers.get(route.path()));
            LOG.debug("Route {}: {}", route, route.description());
        }
        created.error(404, new NotFoundHandler());
        created.exception(HttpResponseException.class, (e, ctx) -> {
            ctx.status(e.getStatus());
            ctx.result(e.getStatus() == 404
                    ? ErrorResponses.notFound(ctx.path()).toString()
                    : ErrorResponses.badRequest(e.getMessage()).toString());
        });
        created.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            ctx.status(500);
            ctx.result(ErrorResponses.internalError().toString());
        });

        if (material != null) {
            created.start();
        } else {
            created.start(bindHost, settings.port());
        }
        app = created;
        active = settings;
        LOG.info(
                "Server started on {}{}",
                address(),
                settings.authEnabled() ? " (auth enabled)" : "");
    }

    /** Stops serving. A no-op when not running. */
    public synchronized void stop() {
        if (app == null) {
            return;
        }
        String previous = address();
        app.stop();
        app = null;
        active = null;
        LOG.info("Server stopped on {}", previous);
    }

    /** Stops, then starts with {@code settings}. */
    public synchronized void restart(ServerRuntimeSettings settings) {
        stop();
        start(settings);
    }

    public synchronized boolean isRunning() {
        return app != null;
    }

    /** Bound port, or -1 when stopped. */
    public synchronized int port() {
        return app != null ? app.port() : -1;
    }

    public synchronized boolean isHttps() {
        return active != null && active.httpsEnabled();
    }

    public synchronized boolean isAuthEnabled() {
        return active != null && active.authEnabled();
    }

    /** {@code scheme://bind-host:port}, or {@code null} when stopped. */
    public synchronized String address() {
        if (app == null) {
            return null;
        }
        return active.scheme() + "://" + bindHost + ":" + app.port();
    }

    private CertificateMaterial loadIdentity() {
        if (identityManager.ensure()) {
            LOG.info("No TLS identity found, a new one was generated");
        }
        CertificateMaterial material = identityManager.current()
                .orElseThrow(() -> new IllegalStateException("TLS identity missing after generation"));
        CertificateDetails details = CertificateDetails.of(material);
        LOG.info(
                "Serving certificate: subject={}, serial={}, notBefore={}, notAfter={}, key={}, fingerprint={}",
                details.subject(),
                details.serialNumber(),
                details.notBefore(),
                details.notAfter(),
                details.publicKey(),
                details.fingerprint());
        return material;
    }

    private Map<String, Handler> routeHandlers() {
        HealthHandler health = new HealthHandler();
        return Map.of(
                "/", health,
                "/health", health,
                "/connect", new ConnectHandler(orchestrator),
                "/disconnect", new DisconnectHandler(orchestrator),
                "/status", new StatusHandler(orchestrator),
                "/swagger", new SwaggerHandler());
    }
}
