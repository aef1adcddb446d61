package com.askbetter.core.merge;

import com.askbetter.core.model.Flag;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Unions generated and locally detected flags into one ordered, duplicate-free list.
 * PII flags always precede advisory flags.
 */
@Component
public class FlagMerger {

    private static final Comparator<Flag> PRIORITY =
            Comparator.comparing(Flag::category).thenComparing(Comparator.naturalOrder());

    public List<Flag> merge(Collection<Flag> generated, Collection<Flag> local) {
        EnumSet<Flag> union = EnumSet.noneOf(Flag.class);
        if (generated != null) {
            union.addAll(generated);
        }
        if (local != null) {
            union.addAll(local);
        }
        return union.stream().sorted(PRIORITY).toList();
    }
}
