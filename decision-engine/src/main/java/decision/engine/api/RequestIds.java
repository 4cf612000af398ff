package decision.engine.api;

import java.util.UUID;

final class RequestIds {
    private RequestIds() {
    }

    static String next() {
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }
}
