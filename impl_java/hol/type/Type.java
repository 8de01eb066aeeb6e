package hol.type;

import java.util.Set;

public sealed interface Type permits TypeVar, TypeConstructor {
    Type applySub(TypeSubstitution substitution);

    Set<TypeVar> vars();
}
