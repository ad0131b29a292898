package com.shellguard.security.handler;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.security.EvaluationPipeline;
import com.shellguard.security.FragmentEvaluator;
import com.shellguard.security.PolicyConfig;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FindHandlerTest {

    private final FindHandler handler = new FindHandler();
    private final EvaluationPipeline pipeline = new EvaluationPipeline(PolicyConfig.defaults());

    private HandlerResult check(String args) {
        return handler.check(Arrays.asList(args.split(" ")), pipeline);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            ". -name *.tmp -delete",
            ". -fprint out.txt",
            ". -fprint0 out.txt",
            ". -fprintf out.txt %p",
            ". -fls out.txt",
            ". -exec rm {} ;",
            ". -execdir rm -f {} +",
            ". -ok rm {} ;",
            ". -okdir rm {} ;",
            ". -exec grep foo {} ; -exec rm {} ;",
            ". -exec {} ;",
            ". -exec grep foo {}",
            ". -exec bash -c ls ;"
    })
    void rejectsDestructiveOrUnsafeActions(String args) {
        assertEquals(HandlerResult.REJECT, check(args));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            ". -name *.java",
            ". -type f -newer pom.xml -print",
            ". -exec grep -l foo {} ;",
            ". -execdir wc -l {} +",
            ". -name *.md -exec head -1 {} ; -print"
    })
    void passesReadOnlySearches(String args) {
        assertEquals(HandlerResult.PASS, check(args));
    }

    @Test
    void innerCommandGoesThroughEvaluator() {
        var evaluator = mock(FragmentEvaluator.class);
        when(evaluator.trace()).thenReturn(DecisionTrace.NOOP);
        when(evaluator.evaluate(any())).thenReturn(StageResult.APPROVE);

        var result = handler.check(List.of(".", "-exec", "stat", "-c", "%s", "{}", "+"), evaluator);

        assertEquals(HandlerResult.PASS, result);
        verify(evaluator).evaluate(CommandFragment.of("stat", "-c", "%s"));
    }

    @Test
    void evaluatorRejectionRejectsFind() {
        var evaluator = mock(FragmentEvaluator.class);
        when(evaluator.trace()).thenReturn(DecisionTrace.NOOP);
        when(evaluator.evaluate(any())).thenReturn(StageResult.REJECT);

        assertEquals(HandlerResult.REJECT, handler.check(List.of(".", "-exec", "cat", "{}", ";"), evaluator));
    }

    @Test
    void noExecMeansNoEvaluation() {
        var evaluator = mock(FragmentEvaluator.class);
        when(evaluator.trace()).thenReturn(DecisionTrace.NOOP);

        handler.check(List.of(".", "-name", "x"), evaluator);

        verify(evaluator, never()).evaluate(any());
    }
}
