package org.stl.expressions;

import lombok.Getter;
import org.stl.utils.ValueRange;

import java.util.Objects;
import java.util.Set;

/**
 * 对轨迹中命名信号的引用，可以附带已知值域。
 */
public final class SignalRef extends Formula {

    @Getter
    private final String name;

    private SignalRef(String name, ValueRange range) {
        super(Set.of(Objects.requireNonNull(name, "SignalRef-构造函数: name 不能为 null")), 0.0, range);
        this.name = name;
    }

    public static SignalRef of(String name) {
        return new SignalRef(name, null);
    }

    public static SignalRef of(String name, ValueRange range) {
        return new SignalRef(name, range);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitSignalRef(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SignalRef that = (SignalRef) o;
        return name.equals(that.name) && getRange().equals(that.getRange());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getRange());
    }
}
