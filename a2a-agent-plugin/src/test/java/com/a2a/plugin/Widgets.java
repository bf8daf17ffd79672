package com.a2a.plugin;

import com.a2a.annotations.A2aPlugin;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test slot "widgets" (no-arg plugins) and "gadgets" (plugins built around a Widget), with the
 * plugin classes referenced by the test extension manifests.
 */
public final class Widgets {

    public static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();

    public static final PluginSlot<Void, Widget> SLOT =
            PluginSlot.of("widgets", Widget.class, Void.class, (arg, id, reason) -> new NotReadyWidget(id, reason));

    public static final PluginSlot<Widget, Gadget> GADGETS =
            PluginSlot.of("gadgets", Gadget.class, Widget.class, (widget, id, reason) -> new NotReadyGadget(widget, id, reason));

    private Widgets() {
    }

    public interface Widget {

        String name();

        default boolean isReady() {
            return true;
        }

        default String reason() {
            return null;
        }
    }

    public interface Gadget {

        Widget widget();

        String name();
    }

    public static final class NotReadyWidget implements Widget {

        private final String id;
        private final String reason;

        NotReadyWidget(String id, String reason) {
            this.id = id;
            this.reason = reason;
        }

        @Override
        public String name() {
            return id;
        }

        @Override
        public boolean isReady() {
            return false;
        }

        @Override
        public String reason() {
            return reason;
        }
    }

    public static final class NotReadyGadget implements Gadget {

        private final Widget widget;
        private final String id;
        private final String reason;

        NotReadyGadget(Widget widget, String id, String reason) {
            this.widget = widget;
            this.id = id;
            this.reason = reason;
        }

        @Override
        public Widget widget() {
            return widget;
        }

        @Override
        public String name() {
            return id + " not ready: " + reason;
        }
    }

    @A2aPlugin(id = "plain", slot = "widgets")
    public static final class PlainWidget implements Widget {

        public PlainWidget() {
            CONSTRUCTIONS.incrementAndGet();
        }

        @Override
        public String name() {
            return "plain";
        }
    }

    public static final class OverridingWidget implements Widget {

        public OverridingWidget() {
            CONSTRUCTIONS.incrementAndGet();
        }

        @Override
        public String name() {
            return "overriding";
        }
    }

    public static final class FancyWidgetFactory implements PluginFactory<Void, Widget> {

        @Override
        public Widget create(Void argument) {
            CONSTRUCTIONS.incrementAndGet();
            return () -> "fancy";
        }
    }

    public static final class ExplodingWidget implements Widget {

        public ExplodingWidget() {
            CONSTRUCTIONS.incrementAndGet();
            throw new IllegalStateException("boom");
        }

        @Override
        public String name() {
            return "never";
        }
    }

    public static final class NotAWidget {
    }

    @A2aPlugin(id = "orphan", slot = "gadgets")
    public static final class WrongSlotWidget implements Widget {

        @Override
        public String name() {
            return "orphan";
        }
    }

    public static final class UnannotatedWidget implements Widget {

        @Override
        public String name() {
            return "unannotated";
        }
    }

    public static final class WrappingGadget implements Gadget {

        private final Widget widget;

        public WrappingGadget(Widget widget) {
            this.widget = widget;
        }

        @Override
        public Widget widget() {
            return widget;
        }

        @Override
        public String name() {
            return "wrapping " + widget.name();
        }
    }

    public static final class NoArgGadget implements Gadget {

        public NoArgGadget() {
        }

        @Override
        public Widget widget() {
            return null;
        }

        @Override
        public String name() {
            return "no-arg";
        }
    }
}
