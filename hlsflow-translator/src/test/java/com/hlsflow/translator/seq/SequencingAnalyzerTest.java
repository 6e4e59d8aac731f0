package com.hlsflow.translator.seq;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.translator.ErrorCategory;
import com.hlsflow.translator.TranslationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Deque;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SequencingAnalyzer 测试")
class SequencingAnalyzerTest {

    private static final String A = AccessSet.variableRoot(0, "a", 0);
    private static final String B = AccessSet.variableRoot(0, "b", 0);

    private SequencingAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SequencingAnalyzer();
    }

    private AccessSet record(Runnable accesses) {
        AccessSet set = analyzer.begin();
        accesses.run();
        analyzer.end(set);
        return set;
    }

    @Test
    @DisplayName("读读不冲突")
    void testReadsDoNotConflict() {
        AccessSet left = record(() -> analyzer.recordRead(A));
        AccessSet right = record(() -> analyzer.recordRead(A));
        assertThatCode(() -> analyzer.check(Arrays.asList(left, right), SourceLocation.UNKNOWN))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("读写冲突与兄弟顺序无关")
    void testWriteReadConflict() {
        AccessSet write = record(() -> analyzer.recordAssignment(A));
        AccessSet read = record(() -> analyzer.recordRead(A));

        for (AccessSet[] order : new AccessSet[][]{{write, read}, {read, write}}) {
            TranslationException e = catchThrowableOfType(
                    () -> analyzer.check(Arrays.asList(order), SourceLocation.UNKNOWN), TranslationException.class);
            assertThat(e.getCategory()).isEqualTo(ErrorCategory.SEQUENCING);
            assertThat(e.getDetail()).isEqualTo("unsequenced modification and access to 'a'");
        }
    }

    @Test
    @DisplayName("嵌套记录器同时记录内层访问")
    void testNestedRecorders() {
        AccessSet outer = analyzer.begin();
        AccessSet inner = record(() -> analyzer.recordWrite(B));
        analyzer.end(outer);

        assertThat(inner.getWrites()).containsExactly(B);
        assertThat(outer.getWrites()).containsExactly(B);
        assertThat(outer.hasAssignments()).isFalse();
    }

    @Test
    @DisplayName("被调函数体的访问不计入调用者")
    void testDetach() {
        AccessSet outer = analyzer.begin();
        Deque<AccessSet> saved = analyzer.detach();
        analyzer.recordWrite(A);
        analyzer.reattach(saved);
        analyzer.recordRead(B);
        analyzer.end(outer);

        assertThat(outer.getWrites()).isEmpty();
        assertThat(outer.getReads()).containsExactly(B);
    }

    @Test
    @DisplayName("多实参中任一实参含赋值")
    void testCallArguments() {
        AccessSet assigns = record(() -> analyzer.recordAssignment(A));
        AccessSet constant = record(() -> { });

        assertThatCode(() -> analyzer.checkCallArguments(Arrays.asList(assigns), SourceLocation.UNKNOWN))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> analyzer.checkCallArguments(Arrays.asList(assigns, constant), SourceLocation.UNKNOWN))
                .isInstanceOf(TranslationException.class)
                .hasMessage("unsequenced assignment in call arguments");
    }

    @Test
    @DisplayName("通道操作同时读写通道根")
    void testChannelRoot() {
        AccessSet set = record(() -> analyzer.recordChannel("in"));
        assertThat(set.getReads()).containsExactly(AccessSet.channelRoot("in"));
        assertThat(set.getWrites()).containsExactly(AccessSet.channelRoot("in"));
        assertThat(AccessSet.displayName(AccessSet.channelRoot("in"))).isEqualTo("in");
    }
}
