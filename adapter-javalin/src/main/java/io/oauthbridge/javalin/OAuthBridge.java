package io.oauthbridge.javalin;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.model.Grant;
import io.oauthbridge.core.model.ResourceOutcome;
import io.oauthbridge.core.operation.EndpointWorker;
import io.oauthbridge.core.operation.Operation;
import io.oauthbridge.core.operation.OperationRunner;
import io.oauthbridge.core.operation.Resource;
import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResponse;
import io.oauthbridge.javalin.adapter.JavalinAdapter;
import io.oauthbridge.javalin.config.BridgeConfig;
import io.oauthbridge.javalin.http.WebExceptionHandler;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the adapter into a Javalin application.
 *
 * <p>
 * Typical use:
 * <pre>{@code
 * OAuthBridge bridge = OAuthBridge.create(ConfigLoader.load(path));
 * EndpointWorker<OAuthRequest, OAuthResponse> worker = bridge.startWorker(engine);
 * Javalin app = Javalin.create();
 * bridge.install(app);
 * app.get("/authorize", bridge.handler(worker, Authorize::new));
 * app.post("/token", bridge.handler(worker, Token::new));
 * app.before("/api/*", bridge.resourceGuard(worker));
 * }</pre>
 */
public final class OAuthBridge {

    private static final Logger LOG = LoggerFactory.getLogger(OAuthBridge.class);

    /** Context attribute holding the {@link Grant} of a request that passed the resource guard. */
    public static final String GRANT_ATTRIBUTE = "oauth.grant";

    private final BridgeConfig config;
    private final JavalinAdapter adapter;
    private final WebExceptionHandler exceptionHandler;

    private OAuthBridge(BridgeConfig config) {
        this.config = config;
        this.adapter = new JavalinAdapter();
        this.exceptionHandler = new WebExceptionHandler(config.errorStatus());
    }

    public static OAuthBridge create(BridgeConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new OAuthBridge(config);
    }

    /** Registers the {@link WebException} renderer on {@code app}. */
    public OAuthBridge install(Javalin app) {
        app.exception(WebException.class, exceptionHandler);
        LOG.info("OAuth bridge installed: statusOverrides={}", config.errorStatus().overrides());
        return this;
    }

    /** Starts a worker owning {@code endpoint}, sized and named from the configuration. */
    public EndpointWorker<OAuthRequest, OAuthResponse> startWorker(Endpoint<OAuthRequest, OAuthResponse> endpoint) {
        return new EndpointWorker<>(endpoint, config.workerName(), config.mailboxCapacity(), config.timeout());
    }

    /**
     * Handler running one flow per request.
     *
     * @param runner  where the operation runs
     * @param factory creates the operation for a wrapped request, such as
     *                {@code Token::new}
     */
    public Handler handler(
            OperationRunner<OAuthRequest, OAuthResponse> runner,
            Function<OAuthRequest, ? extends Operation<OAuthRequest, OAuthResponse, OAuthResponse>> factory) {
        Objects.requireNonNull(runner, "runner must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        return ctx -> {
            OAuthRequest request = adapter.wrapRequest(ctx);
            OAuthResponse response = runner.execute(factory.apply(request));
            adapter.applyResponse(response, ctx);
        };
    }

    /**
     * Before-handler protecting resources. A granted request continues with
     * its {@link Grant} under {@value #GRANT_ATTRIBUTE}; a denied one receives
     * the engine's response and no further handlers run.
     */
    public Handler resourceGuard(OperationRunner<OAuthRequest, OAuthResponse> runner) {
        Objects.requireNonNull(runner, "runner must not be null");
        return ctx -> {
            ResourceOutcome<OAuthResponse> outcome = runner.execute(new Resource(adapter.wrapResource(ctx)));
            if (outcome.isGranted()) {
                ctx.attribute(GRANT_ATTRIBUTE, outcome.grant());
                return;
            }
            LOG.debug("Resource access denied: path={}, status={}", ctx.path(), outcome.response().status());
            adapter.applyResponse(outcome.response(), ctx);
            ctx.skipRemainingHandlers();
        };
    }

    /** The grant stored by {@link #resourceGuard}, or {@code null}. */
    public static Grant grant(Context ctx) {
        return ctx.attribute(GRANT_ATTRIBUTE);
    }

    public BridgeConfig config() {
        return config;
    }

    public JavalinAdapter adapter() {
        return adapter;
    }

    public WebExceptionHandler exceptionHandler() {
        return exceptionHandler;
    }
}
