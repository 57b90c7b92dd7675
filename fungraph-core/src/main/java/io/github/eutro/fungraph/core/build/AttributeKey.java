package io.github.eutro.fungraph.core.build;

import io.github.eutro.fungraph.core.scope.AreaTemplate;

/**
 * A context attribute of one area template.
 */
final class AttributeKey {
    final int template;
    final String attribute;

    AttributeKey(int template, String attribute) {
        this.template = template;
        this.attribute = attribute;
    }

    static AttributeKey of(AreaTemplate template, String attribute) {
        return new AttributeKey(template.id, attribute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeKey)) return false;
        AttributeKey that = (AttributeKey) o;
        return template == that.template && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return 31 * template + attribute.hashCode();
    }

    @Override
    public String toString() {
        return "@" + template + ":" + attribute;
    }
}
