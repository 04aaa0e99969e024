package work.lcod.strata.template;

/**
 * A named accessor exposed to a templating engine.
 */
@FunctionalInterface
public interface TreeFunction {
    Object apply(Object... keys);
}
