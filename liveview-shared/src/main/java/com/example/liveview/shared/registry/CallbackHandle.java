package com.example.liveview.shared.registry;

import com.example.liveview.shared.util.LiveScripts;

public record CallbackHandle(long id) {

    /**
     * Client-side expression that invokes this callback with the given script expressions as arguments.
     */
    public String invocation(String... jsArgs) {
        return LiveScripts.callbackInvocation(id, jsArgs);
    }
}
