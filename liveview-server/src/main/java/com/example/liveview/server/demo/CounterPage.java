package com.example.liveview.server.demo;

import com.example.liveview.shared.context.PageRenderer;
import com.example.liveview.shared.registry.CallbackHandle;
import com.example.liveview.shared.registry.ComponentDefinition;
import com.example.liveview.shared.registry.LiveCallback;
import com.example.liveview.shared.registry.RenderScope;
import com.example.liveview.shared.source.LiveSources;
import com.example.liveview.shared.source.VariableSource;
import com.example.liveview.shared.util.LiveScripts;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Small page that exercises every path of the engine: a per-tab counter driven by callbacks,
 * a clock driven by a timer publisher, and an attribute toggled by the counter's parity.
 */
public class CounterPage implements PageRenderer {

    @Override
    public void render(RenderScope scope) throws Exception {
        VariableSource<Integer> counter = LiveSources.variable(0);

        scope.write("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Live counter</title>")
                .write(LiveScripts.clientScriptTag())
                .write("<style>.even{color:green}.odd{color:red}</style></head><body>");

        long anchor = scope.anchor();
        scope.write("<p " + RenderScope.COMPONENT_ATTRIBUTE + "=\"" + anchor + "\" class=\"even\">Count: ");
        scope.component(ComponentDefinition.markup(LiveSources.view(counter),
                (child, value) -> child.write(String.valueOf(value))));
        scope.write("</p>");
        scope.child(anchor).register(ComponentDefinition.attribute(LiveSources.computed(counter, v -> v % 2 == 0),
                even -> Map.of("class", even ? "even" : "odd")));

        CallbackHandle increment = scope.callback(LiveCallback.of(() -> counter.update(v -> v + 1)));
        CallbackHandle reset = scope.callback(LiveCallback.of(() -> counter.set(0)));
        scope.write("<button onclick=\"" + HtmlUtils.htmlEscape(increment.invocation()) + "\">+1</button>")
                .write("<button onclick=\"" + HtmlUtils.htmlEscape(reset.invocation()) + "\">reset</button>");

        scope.write("<p>Server time: ");
        scope.component(ComponentDefinition.markup(
                LiveSources.fromPublisher(Flux.interval(Duration.ofSeconds(1)).map(tick -> now()), now()),
                (child, time) -> child.write(HtmlUtils.htmlEscape(time))));
        scope.write("</p></body></html>");
    }

    private static String now() {
        return LocalTime.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
