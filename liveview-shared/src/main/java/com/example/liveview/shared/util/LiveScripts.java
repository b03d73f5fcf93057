package com.example.liveview.shared.util;

import java.util.UUID;

/**
 * Snippets a page embeds to talk to {@code live-client.js}.
 */
public final class LiveScripts {

    public static final String CLIENT_SCRIPT_PATH = "/live-client.js";

    private LiveScripts() {}

    public static String clientScriptTag() {
        return "<script src=\"" + CLIENT_SCRIPT_PATH + "\"></script>";
    }

    public static String connectScript(String endpointPath, UUID contextId) {
        return "<script>window._rl.connect(\"" + endpointPath + "\",\"" + contextId + "\");</script>";
    }

    public static String callbackInvocation(long callbackId, String... jsArgs) {
        StringBuilder call = new StringBuilder("window._rl.call(").append(callbackId);
        for (String arg : jsArgs) {
            call.append(',').append(arg);
        }
        return call.append(')').toString();
    }
}
