package com.shellguard.security;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WrapperNormalizerTest {

    private final WrapperNormalizer normalizer = new WrapperNormalizer(DecisionTrace.NOOP);

    private Normalization normalize(String... words) {
        return normalizer.normalize(CommandFragment.of(Arrays.asList(words)));
    }

    @Test
    void plainCommandIsUntouched() {
        var result = normalize("ls", "-la");
        assertEquals(StageResult.CONTINUE, result.result());
        assertEquals(CommandFragment.of("ls", "-la"), result.fragment());
    }

    @ParameterizedTest
    @CsvSource({
            "/usr/bin/ls, ls",
            "./rm, rm",
            "../bin/cat, cat",
            "ls, ls"
    })
    void reducesPathToBasename(String executable, String expected) {
        assertEquals(expected, normalize(executable).fragment().executable());
    }

    @Test
    void unwrapsEnvAssignmentsAndFlags() {
        var result = normalize("env", "-i", "-u", "BAR", "FOO=1", "ls", "-l");
        assertEquals(CommandFragment.of("ls", "-l"), result.fragment());
        assertEquals(CommandFragment.of("ls"), normalize("env", "-iuBAR", "--chdir", "/tmp", "--", "ls").fragment());
    }

    @Test
    void envOptionsEndAtFirstAssignment() {
        var result = normalize("env", "FOO=1", "-u", "BAR", "ls");
        assertEquals(StageResult.CONTINUE, result.result());
        assertEquals("-u", result.fragment().executable());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "env -P /tmp ls",
            "env -Z ls",
            "env --frob ls",
            "env --d ls",
            "nice -x ls",
            "nice --niceness=3 ls",
            "time -o out ls",
            "time --o=out ls",
            "time -Z ls",
            "command --verbose ls",
            "command -x ls",
            "nohup -x ls"
    })
    void unknownWrapperOptionRejects(String line) {
        assertEquals(StageResult.REJECT, normalize(line.split(" ")).result());
    }

    @Test
    void envWithOnlyAssignmentsApproves() {
        assertEquals(StageResult.APPROVE, normalize("env", "FOO=1").result());
        assertEquals(StageResult.APPROVE, normalize("env").result());
    }

    @Test
    void envSplitStringRejects() {
        assertEquals(StageResult.REJECT, normalize("env", "-S", "rm -rf /").result());
        assertEquals(StageResult.REJECT, normalize("env", "--split-string=rm -rf /").result());
        assertEquals(StageResult.REJECT, normalize("env", "-iS", "rm x").result());
    }

    @Test
    void unwrapsNice() {
        assertEquals(CommandFragment.of("cat", "f"), normalize("nice", "-n", "10", "cat", "f").fragment());
        assertEquals(CommandFragment.of("cat", "f"), normalize("nice", "-5", "cat", "f").fragment());
        assertEquals(CommandFragment.of("cat", "f"), normalize("nice", "--adjustment=3", "cat", "f").fragment());
    }

    @Test
    void unwrapsTime() {
        assertEquals(CommandFragment.of("ls"), normalize("time", "-p", "ls").fragment());
        assertEquals(CommandFragment.of("ls"), normalize("time", "-f", "%e", "ls").fragment());
    }

    @Test
    void timeWritingReportFileRejects() {
        assertEquals(StageResult.REJECT, normalize("time", "-o", "out.txt", "ls").result());
        assertEquals(StageResult.REJECT, normalize("time", "--output=out.txt", "ls").result());
    }

    @Test
    void commandLookupApproves() {
        assertEquals(StageResult.APPROVE, normalize("command", "-v", "git").result());
        assertEquals(StageResult.APPROVE, normalize("command", "-V", "rm").result());
    }

    @Test
    void unwrapsCommand() {
        assertEquals(CommandFragment.of("rm", "x"), normalize("command", "-p", "rm", "x").fragment());
        assertEquals(CommandFragment.of("ls"), normalize("command", "--", "ls").fragment());
    }

    @Test
    void unwrapsNohup() {
        assertEquals(CommandFragment.of("ls"), normalize("nohup", "ls").fragment());
        assertEquals(StageResult.APPROVE, normalize("nohup").result());
    }

    @Test
    void unwrapsNestedWrappers() {
        var result = normalize("env", "A=1", "nice", "-n", "5", "/usr/bin/time", "-p", "/bin/cat", "f");
        assertEquals(StageResult.CONTINUE, result.result());
        assertEquals(CommandFragment.of("cat", "f"), result.fragment());
    }

    @Test
    void expandedExecutableRejects() {
        var fragment = new CommandFragment("$X", List.of("-la"), false, Set.of(0));
        assertEquals(StageResult.REJECT, normalizer.normalize(fragment).result());

        var wrapped = new CommandFragment("env", List.of("$X", "-la"), false, Set.of(1));
        assertEquals(StageResult.REJECT, normalizer.normalize(wrapped).result());
    }

    @Test
    void expandedWrapperOptionRejects() {
        var fragment = new CommandFragment("nice", List.of("-n", "$N", "ls"), false, Set.of(2));
        assertEquals(StageResult.REJECT, normalizer.normalize(fragment).result());
    }

    @Test
    void expansionPositionsFollowTheUnwrappedCommand() {
        var fragment = new CommandFragment("nohup", List.of("find", ".", "$X"), false, Set.of(3));
        var result = normalizer.normalize(fragment);
        assertEquals(StageResult.CONTINUE, result.result());
        assertEquals("find", result.fragment().executable());
        assertTrue(result.fragment().isExpanded(2));
        assertFalse(result.fragment().isExpanded(0));
    }

    @Test
    void keepsRedirectFlagWhenUnwrapping() {
        var fragment = new CommandFragment("env", List.of("ls"), true);
        assertTrue(normalizer.normalize(fragment).fragment().hasOutputRedirect());
    }
}
