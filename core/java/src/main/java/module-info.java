module io.github.cyfko.fuzzycast.core {
    requires java.logging;

    exports io.github.cyfko.fuzzycast.core;
    exports io.github.cyfko.fuzzycast.core.api;
    exports io.github.cyfko.fuzzycast.core.config;
    exports io.github.cyfko.fuzzycast.core.exception;
    exports io.github.cyfko.fuzzycast.core.impl;
    exports io.github.cyfko.fuzzycast.core.model;
    exports io.github.cyfko.fuzzycast.core.spi;
    exports io.github.cyfko.fuzzycast.core.utils;
}
