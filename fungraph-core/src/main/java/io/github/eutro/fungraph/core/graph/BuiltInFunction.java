package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.ext.ExtHolder;

/**
 * A built-in function, without arguments. Per-function rules, such as purity or the argument writes
 * pass through to, are attached as exts (see {@link io.github.eutro.fungraph.core.ext.GraphExts}).
 */
public class BuiltInFunction extends ExtHolder {
    public final String mnemonic;
    public final int minArgs;
    public final int maxArgs;

    public BuiltInFunction(String mnemonic, int minArgs, int maxArgs) {
        this.mnemonic = mnemonic;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * Check that the function can be applied to {@code n} arguments.
     *
     * @param n The number of arguments.
     * @throws IllegalArgumentException If it cannot.
     */
    public void checkArity(int n) {
        if (n < minArgs || n > maxArgs) {
            throw new IllegalArgumentException(mnemonic + " takes "
                    + (minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + ".." + (maxArgs == Integer.MAX_VALUE ? "" : maxArgs))
                    + " arguments, got " + n);
        }
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
