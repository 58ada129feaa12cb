package com.marketrouter.routing.registry;

/**
 * How an object was recognised as a data source, in the order the probe tries them.
 */
public enum ProbeMethod {
    /** Implements {@link com.marketrouter.common.provider.DataSourceProvider}. */
    INTERFACE,
    /** Exposes {@code getSupportedDataTypes()} plus an extraction method. */
    REQUIRED_METHODS,
    /** Annotated with {@link com.marketrouter.common.provider.DataSourcePlugin}. */
    DECLARED_TYPE,
    /** Class name contains a data-source indicator. */
    NAME_HEURISTIC
}
