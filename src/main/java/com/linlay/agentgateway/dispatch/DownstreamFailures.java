package com.linlay.agentgateway.dispatch;

import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.service.GatewayException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Maps outbound call failures onto the gateway error taxonomy.
 */
public final class DownstreamFailures {

    private static final int MAX_CAUSE_DEPTH = 10;

    private DownstreamFailures() {
    }

    public static GatewayException classify(Capability capability, Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        if (isTimeout(error)) {
            return GatewayException.timeout(capability, error);
        }
        if (isUnreachable(error)) {
            return GatewayException.unavailable(capability, error);
        }
        return GatewayException.downstreamError(capability, error);
    }

    public static boolean isUnreachable(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isTimeout(Throwable error) {
        if (error instanceof TimeoutException || error instanceof ReadTimeoutException) {
            return true;
        }
        return error instanceof WebClientRequestException
                && (error.getCause() instanceof TimeoutException || error.getCause() instanceof ReadTimeoutException);
    }
}
