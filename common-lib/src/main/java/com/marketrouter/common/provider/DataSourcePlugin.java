package com.marketrouter.common.provider;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a class as a market data source without it implementing
 * {@link DataSourceProvider}. The registry adapts such classes reflectively.
 *
 * <p>Capability strings accept enum names or aliases ("kline", "realtime", "equity").
 * Empty arrays mean "not declared"; the registry then infers values from the name.
 * A negative {@code priority} means "derive automatically".
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DataSourcePlugin {

    String name() default "";

    String[] assetTypes() default {};

    String[] dataTypes() default {};

    String[] markets() default {};

    int priority() default -1;
}
