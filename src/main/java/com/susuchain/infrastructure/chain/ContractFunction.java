package com.susuchain.infrastructure.chain;

import java.util.Objects;

/**
 * A contract function identified by its canonical signature and 4-byte selector.
 */
public final class ContractFunction {

    private final String signature;
    private final String selector;

    private ContractFunction(String signature, String selector) {
        if (!selector.matches("^0x[0-9a-f]{8}$")) {
            throw new IllegalArgumentException("Selector must be 4 bytes of lowercase hex: " + selector);
        }
        this.signature = signature;
        this.selector = selector;
    }

    public static ContractFunction of(String signature, String selector) {
        return new ContractFunction(signature, selector);
    }

    public String getSignature() {
        return signature;
    }

    public String getSelector() {
        return selector;
    }

    public String getName() {
        int paren = signature.indexOf('(');
        return paren < 0 ? signature : signature.substring(0, paren);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContractFunction)) {
            return false;
        }
        ContractFunction that = (ContractFunction) o;
        return signature.equals(that.signature) && selector.equals(that.selector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, selector);
    }

    @Override
    public String toString() {
        return signature + " [" + selector + "]";
    }
}
