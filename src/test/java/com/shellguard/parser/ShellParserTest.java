package com.shellguard.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ShellParserTest {

    private static Node single(String source) throws ShellParseException {
        var nodes = ShellParser.parse(source);
        assertEquals(1, nodes.size());
        return nodes.get(0);
    }

    private static List<String> words(Node command) {
        return command.parts().stream().filter(p -> p.is(NodeKind.WORD)).map(Node::text).toList();
    }

    @Test
    void parsesSimpleCommand() throws Exception {
        var node = single("ls -la /tmp");
        assertEquals(NodeKind.COMMAND, node.kind());
        assertEquals(List.of("ls", "-la", "/tmp"), words(node));
    }

    @Test
    void removesQuotes() throws Exception {
        var node = single("grep 'a b' \"c d\" e\\ f");
        assertEquals(List.of("grep", "a b", "c d", "e f"), words(node));
    }

    @Test
    void decodesAnsiCQuotedText() throws Exception {
        assertEquals(List.of("printf", "a\tb"), words(single("printf $'a\\tb'")));
        assertEquals(List.of("echo", "-delete"), words(single("echo $'-\\x64el\\145te'")));
        assertEquals(List.of("echo", "it's \u00e9"), words(single("echo $'it\\'s \\u00e9'")));
        assertEquals(List.of("echo", "\\q\u0001"), words(single("echo $'\\q\\ca'")));
    }

    @Test
    void ansiCNulIsRejected() {
        assertThrows(ShellParseException.class, () -> ShellParser.parse("echo $'a\\0b'"));
        assertThrows(ShellParseException.class, () -> ShellParser.parse("echo $'\\x00'"));
    }

    @Test
    void unquotedPatternCharactersAreGlobParts() throws Exception {
        var node = single("ls *.txt src/?.java [ab].md '*.md'");
        var words = node.parts();
        assertEquals(NodeKind.GLOB, words.get(1).parts().get(0).kind());
        assertEquals(NodeKind.GLOB, words.get(2).parts().get(0).kind());
        assertEquals(NodeKind.GLOB, words.get(3).parts().get(0).kind());
        assertTrue(words.get(4).parts().isEmpty());
    }

    @Test
    void testBracketIsNotAGlob() throws Exception {
        var node = single("[ -f x ]");
        assertTrue(node.parts().stream().allMatch(p -> p.parts().isEmpty()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"echo {a,b}", "echo x{1..3}", "find . -{delete,print}", "echo {a,\"b\"}"})
    void braceExpansionIsRejected(String source) {
        assertThrows(ShellParseException.class, () -> ShellParser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"echo '{a,b}'", "echo {}", "echo \\{a,b}", "echo ${x,,}", "{ ls; }"})
    void bracesWithoutExpansionParse(String source) {
        assertDoesNotThrow(() -> ShellParser.parse(source));
    }

    @Test
    void emptyAndCommentOnlyProgramsHaveNoNodes() throws Exception {
        assertTrue(ShellParser.parse("").isEmpty());
        assertTrue(ShellParser.parse("   \n\n").isEmpty());
        assertTrue(ShellParser.parse("# nothing here").isEmpty());
    }

    @Test
    void commentEndsAtNewline() throws Exception {
        var node = single("# first\nls");
        assertEquals(List.of("ls"), words(node));
    }

    @Test
    void hashInsideWordIsLiteral() throws Exception {
        assertEquals(List.of("echo", "a#b"), words(single("echo a#b")));
    }

    @Test
    void parsesPipelineWithPipes() throws Exception {
        var node = single("cat f | grep x |& wc -l");
        assertEquals(NodeKind.PIPELINE, node.kind());
        assertThat(node.parts()).extracting(Node::kind)
                .containsExactly(NodeKind.COMMAND, NodeKind.PIPE, NodeKind.COMMAND, NodeKind.PIPE, NodeKind.COMMAND);
    }

    @Test
    void parsesAndOrList() throws Exception {
        var node = single("make && echo ok || echo fail");
        assertEquals(NodeKind.LIST, node.kind());
        assertThat(node.parts()).filteredOn(p -> p.is(NodeKind.OPERATOR)).extracting(Node::text)
                .containsExactly("&&", "||");
    }

    @Test
    void lineContinuationJoinsWords() throws Exception {
        assertEquals(List.of("ls", "-la"), words(single("ls \\\n-la")));
    }

    @Test
    void commandSubstitutionBecomesChildOfWord() throws Exception {
        var node = single("echo $(whoami)");
        var word = node.parts().get(1);
        assertEquals("$(whoami)", word.text());
        assertEquals(NodeKind.COMMAND_SUBSTITUTION, word.parts().get(0).kind());
    }

    @Test
    void backtickSubstitutionIsParsed() throws Exception {
        var word = single("echo `id -u`").parts().get(1);
        var inner = word.parts().get(0).parts().get(0);
        assertEquals(List.of("id", "-u"), words(inner));
    }

    @Test
    void processSubstitutionRecordsDirection() throws Exception {
        var word = single("diff <(ls a) >(cat)").parts().get(1);
        assertEquals(NodeKind.PROCESS_SUBSTITUTION, word.parts().get(0).kind());
        assertEquals("<", word.parts().get(0).text());
    }

    @Test
    void redirectCarriesOperatorAndTarget() throws Exception {
        var node = single("ls 2>&1 > out.txt");
        var redirects = node.parts().stream().filter(p -> p.is(NodeKind.REDIRECT)).toList();
        assertEquals(2, redirects.size());
        assertEquals(">&", redirects.get(0).text());
        assertEquals("1", redirects.get(0).parts().get(0).text());
        assertEquals(">", redirects.get(1).text());
        assertEquals("out.txt", redirects.get(1).parts().get(0).text());
    }

    @Test
    void heredocBodyIsAttachedToRedirect() throws Exception {
        var node = single("cat <<'EOF'\nhello $(world)\nEOF");
        var redirect = node.parts().get(1);
        assertEquals("<<", redirect.text());
        assertEquals(NodeKind.HEREDOC, redirect.parts().get(1).kind());
        assertEquals("hello $(world)\n", redirect.parts().get(1).text());
    }

    @Test
    void assignmentsBeforeCommandAreNotWords() throws Exception {
        var node = single("FOO=1 BAR+=2 env");
        assertThat(node.parts()).extracting(Node::kind)
                .containsExactly(NodeKind.ASSIGNMENT, NodeKind.ASSIGNMENT, NodeKind.WORD);
    }

    @Test
    void parsesCompoundForms() throws Exception {
        assertEquals(NodeKind.COMPOUND, single("{ ls; pwd; }").kind());
        assertEquals(NodeKind.COMPOUND, single("(cd /tmp && ls)").kind());
        assertEquals(NodeKind.IF, single("if true; then ls; elif false; then pwd; else id; fi").kind());
        assertEquals(NodeKind.FOR, single("for f in a b; do cat $f; done").kind());
        assertEquals(NodeKind.WHILE, single("while read l; do echo $l; done < f").kind());
        assertEquals(NodeKind.UNTIL, single("until false; do ls; done").kind());
        assertEquals(NodeKind.FUNCTION, single("f() { ls; }").kind());
        assertEquals(NodeKind.FUNCTION, single("function g { ls; }").kind());
    }

    @Test
    void reservedWordsAreOrdinaryArguments() throws Exception {
        assertEquals(List.of("echo", "if", "then", "fi"), words(single("echo if then fi")));
    }

    @Test
    void multilineCompoundCommand() throws Exception {
        var node = single("for f in *\ndo\n  wc -l \"$f\"\ndone");
        assertEquals(NodeKind.FOR, node.kind());
    }

    @Test
    void arithmeticCommandIsItsOwnKind() throws Exception {
        assertEquals(NodeKind.ARITHMETIC, single("((i++))").kind());
    }

    @Test
    void extendedTestReadsAsTrue() throws Exception {
        var node = single("[[ $x == y ]]");
        assertEquals(List.of("true", "$x", "==", "y"), words(node));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "echo 'unterminated",
            "echo \"unterminated",
            "echo $(ls",
            "echo `ls",
            "case x in a) ls;; esac",
            "select x in a b; do ls; done",
            "coproc ls",
            "ls ;; pwd",
            "x=(a b)",
            "{ ls }",
            "if true; then ls",
            "ls |",
            "ls >",
            "cat <<EOF\n$(rm -rf /)\nEOF",
            "cat <<EOF\n`rm -rf /`\nEOF",
            "fi",
            ")",
            "ls\0"
    })
    void rejectsUnsupportedOrMalformedInput(String source) {
        assertThrows(ShellParseException.class, () -> ShellParser.parse(source));
    }

    @Test
    void rejectsExcessiveNesting() {
        var source = "echo " + "$(echo ".repeat(ShellParser.MAX_DEPTH + 2) + ")".repeat(ShellParser.MAX_DEPTH + 2);
        assertThrows(ShellParseException.class, () -> ShellParser.parse(source));
    }
}
