package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 一条访存指令的依赖查询结果：要么是局部的 {@link Local}，要么是非局部的 {@link NonLocal}。
 *
 * @param <I> 指令类型
 * @param <A> 地址类型
 */
public interface MemoryDependence<I, A> {

    DependenceKind kind();

    static <I, A> MemoryDependence<I, A> local(DependenceKind kind, I dependent) {
        return new Local<>(kind, dependent);
    }

    static <I, A> MemoryDependence<I, A> nonLocal(List<NonLocalEntry<I, A>> entries) {
        return new NonLocal<>(ImmutableList.copyOf(entries));
    }

    /**
     * 局部依赖，只有一条被依赖的指令。NON_FUNC_LOCAL 和 UNKNOWN 时 dependent 可以为 null。
     */
    record Local<I, A>(DependenceKind kind, I dependent) implements MemoryDependence<I, A> {
        public Local {
            checkNotNull(kind, "kind");
            checkArgument(kind != DependenceKind.NON_LOCAL, "Local dependence cannot be NonLocal");
            checkArgument(dependent != null
                            || kind == DependenceKind.NON_FUNC_LOCAL || kind == DependenceKind.UNKNOWN,
                    "%s dependence needs a dependent instruction", kind);
        }
    }

    /**
     * 非局部依赖：若干 (地址, 被依赖指令) 对
     */
    record NonLocal<I, A>(List<NonLocalEntry<I, A>> entries) implements MemoryDependence<I, A> {
        public NonLocal {
            entries = ImmutableList.copyOf(entries);
        }

        @Override
        public DependenceKind kind() {
            return DependenceKind.NON_LOCAL;
        }
    }

    record NonLocalEntry<I, A>(A address, I dependent) {
        public NonLocalEntry {
            checkNotNull(address, "address");
            checkNotNull(dependent, "dependent");
        }
    }
}
