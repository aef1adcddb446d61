package com.askbetter.core.nodes;

import com.askbetter.core.merge.FlagMerger;
import com.askbetter.core.model.Flag;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.state.ReviewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finalizes the validated review by replacing its flags with the union of the
 * generated flags and the locally scanned ones.
 */
@Component
public class MergeFlagsNode {

    private static final Logger log = LoggerFactory.getLogger(MergeFlagsNode.class);

    private final FlagMerger merger;

    public MergeFlagsNode(FlagMerger merger) {
        this.merger = merger;
    }

    public Map<String, Object> apply(ReviewState state) {
        QuestionReview validated = state.validated()
                .orElseThrow(() -> new IllegalStateException("No validated review to merge flags into"));

        EnumSet<Flag> generated = validated.flags().stream()
                .map(Flag::fromTag)
                .flatMap(Optional::stream)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Flag.class)));
        List<Flag> merged = merger.merge(generated, state.localFlags());

        log.info("Flags merged: generated={} local={} final={}", generated, state.localFlags(), merged);
        return Map.of(
                "review", validated.withFlags(merged),
                "status", ReviewStatus.DONE.name()
        );
    }
}
