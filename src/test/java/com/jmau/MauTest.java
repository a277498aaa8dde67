package com.jmau;

import com.jmau.render.Context;
import com.jmau.render.RenderOptions;
import com.jmau.value.Value;
import com.jmau.value.Values;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class MauTest {

    private final Mau mau = Mau.create();

    @Test
    public void testRenderToString() {
        assertEquals("Hello Ada!", mau.renderToString("Hello {{ name | capitalize }}!", Map.of("name", "ada")));
    }

    @Test
    public void testCompiledTemplateIsReusable() {
        CompiledTemplate template = mau.compile("{% for n in ns %}{{ n * factor }} {% endfor %}");

        assertEquals("2 4 ", mau.renderToString(template, Context.of(Map.of("ns", List.of(1, 2), "factor", 2))));
        assertEquals("3 ", mau.renderToString(template, Context.of(Map.of("ns", List.of(1), "factor", 3))));
    }

    @Test
    public void testNullTemplateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> mau.compile(null));
    }

    @Test
    public void testPreserveTypes() {
        Value value = mau.render("{{ items | sort }}", Map.of("items", List.of(3, 1, 2)), RenderOptions.preservingTypes());

        assertEquals(Values.fromJava(List.of(1, 2, 3)), value);
    }

    @Test
    public void testRuntimeErrorsPropagate() {
        TemplateException e = assertThrows(TemplateException.class,
                () -> mau.renderToString("{{ items | nope }}", Map.of()));
        assertEquals(TemplateException.Kind.RUNTIME, e.kind());
    }

    @Test
    public void testParseErrorsNeverEscapeCompile() {
        assertEquals("{{ ( }} ok", mau.renderToString("{{ ( }} {{ 'ok' }}", Map.of()));
    }

    @Test
    public void testRenderMap() {
        Value template = Values.fromJava(Map.of("title", "{{ name | upper_case }}", "static", 1));

        Value result = mau.renderMap(template, Context.of(Map.of("name", "report")), RenderOptions.defaults());

        assertEquals(Values.fromJava(Map.of("title", "REPORT", "static", 1)), result);
    }

    @Test
    public void testConcurrentRendersOfOneTemplate() throws Exception {
        CompiledTemplate template = mau.compile("{% assign total = 0 %}{% for n in ns %}{% assign total = total + n %}{% endfor %}{{ total }}");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 1; i <= 20; i++) {
                List<Integer> ns = List.of(i, i, i);
                results.add(executor.submit(() -> mau.renderToString(template, Context.of(Map.of("ns", ns)))));
            }
            for (int i = 1; i <= 20; i++) {
                assertEquals(String.valueOf(3 * i), results.get(i - 1).get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
