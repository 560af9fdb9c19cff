package io.oauthbridge.core.testkit;

import io.oauthbridge.core.model.ResourceOutcome;
import io.oauthbridge.core.spi.Endpoint;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResponse;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable engine for tests. Each flow delegates to a replaceable function
 * and every invocation is recorded as {@code "<flow>"} in {@link #calls()}.
 */
public final class StubEndpoint implements Endpoint<OAuthRequest, OAuthResponse> {

    private final List<String> calls = new CopyOnWriteArrayList<>();

    private Function<OAuthRequest, OAuthResponse> authorize = request -> new OAuthResponse();
    private Function<OAuthRequest, OAuthResponse> token = request -> new OAuthResponse();
    private Function<OAuthRequest, OAuthResponse> refresh = request -> new OAuthResponse();
    private Function<OAuthRequest, ResourceOutcome<OAuthResponse>> resource = request -> {
        OAuthResponse response = new OAuthResponse();
        response.unauthorized("Bearer");
        return ResourceOutcome.denied(response);
    };

    public StubEndpoint onAuthorize(Function<OAuthRequest, OAuthResponse> flow) {
        this.authorize = flow;
        return this;
    }

    public StubEndpoint onToken(Function<OAuthRequest, OAuthResponse> flow) {
        this.token = flow;
        return this;
    }

    public StubEndpoint onRefresh(Function<OAuthRequest, OAuthResponse> flow) {
        this.refresh = flow;
        return this;
    }

    public StubEndpoint onResource(Function<OAuthRequest, ResourceOutcome<OAuthResponse>> flow) {
        this.resource = flow;
        return this;
    }

    public List<String> calls() {
        return calls;
    }

    @Override
    public OAuthResponse authorize(OAuthRequest request) {
        calls.add("authorize");
        return authorize.apply(request);
    }

    @Override
    public OAuthResponse token(OAuthRequest request) {
        calls.add("token");
        return token.apply(request);
    }

    @Override
    public OAuthResponse refresh(OAuthRequest request) {
        calls.add("refresh");
        return refresh.apply(request);
    }

    @Override
    public ResourceOutcome<OAuthResponse> resource(OAuthRequest request) {
        calls.add("resource");
        return resource.apply(request);
    }
}
