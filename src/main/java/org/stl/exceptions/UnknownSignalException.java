package org.stl.exceptions;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 公式引用了轨迹中不存在的信号时抛出。
 */
@Getter
public class UnknownSignalException extends StlException {

    private final SortedSet<String> missingSignals;
    private final SortedSet<String> availableSignals;

    public UnknownSignalException(Set<String> missingSignals, Set<String> availableSignals) {
        super("轨迹中不存在信号 " + new TreeSet<>(missingSignals) + "，可用信号为 " + new TreeSet<>(availableSignals));
        this.missingSignals = Collections.unmodifiableSortedSet(new TreeSet<>(missingSignals));
        this.availableSignals = Collections.unmodifiableSortedSet(new TreeSet<>(availableSignals));
    }

    public UnknownSignalException(String missingSignal, Set<String> availableSignals) {
        this(Set.of(missingSignal), availableSignals);
    }
}
