package com.hlsflow.translator.seq;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.translator.TranslationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 未定序表达式检查。
 *
 * <p>翻译一组兄弟子表达式时，每个兄弟开启一个 {@link AccessSet} 记录器；
 * 记录器嵌套时访问会记入栈上的全部记录器。兄弟全部翻译完后两两比较。</p>
 */
public final class SequencingAnalyzer {

    private Deque<AccessSet> recorders = new ArrayDeque<>();

    /** 开始记录一个兄弟子表达式 */
    public AccessSet begin() {
        AccessSet set = new AccessSet();
        recorders.push(set);
        return set;
    }

    public void end(AccessSet set) {
        AccessSet top = recorders.pop();
        if (top != set) {
            throw new IllegalStateException("Unbalanced access recording");
        }
    }

    public void recordRead(String root) {
        for (AccessSet s : recorders) {
            s.addRead(root);
        }
    }

    public void recordWrite(String root) {
        for (AccessSet s : recorders) {
            s.addWrite(root);
        }
    }

    /** 赋值与自增自减：写根并标记 */
    public void recordAssignment(String root) {
        for (AccessSet s : recorders) {
            s.addWrite(root);
            s.markAssignment();
        }
    }

    /** 通道操作同时读写通道 */
    public void recordChannel(String channel) {
        String root = AccessSet.channelRoot(channel);
        recordRead(root);
        recordWrite(root);
    }

    /** 把一个记录器的读写（不含赋值标记）并入当前全部记录器 */
    public void replay(AccessSet set) {
        for (String root : set.getReads()) {
            recordRead(root);
        }
        for (String root : set.getWrites()) {
            recordWrite(root);
        }
    }

    /**
     * 暂时移开当前记录器栈，被调函数体的访问不计入调用者的兄弟组
     */
    public Deque<AccessSet> detach() {
        Deque<AccessSet> saved = recorders;
        recorders = new ArrayDeque<>();
        return saved;
    }

    public void reattach(Deque<AccessSet> saved) {
        recorders = saved;
    }

    /**
     * 兄弟之间不得写写或读写同一根（与顺序无关）
     */
    public void check(List<AccessSet> siblings, SourceLocation location) {
        for (int i = 0; i < siblings.size(); i++) {
            for (int j = i + 1; j < siblings.size(); j++) {
                String root = siblings.get(i).conflictWith(siblings.get(j));
                if (root != null) {
                    throw TranslationException.sequencing("unsequenced modification and access to '"
                            + AccessSet.displayName(root) + "'", location);
                }
            }
        }
    }

    /**
     * 调用实参：两个及以上实参时，任一实参含赋值即视为未定序
     */
    public void checkCallArguments(List<AccessSet> arguments, SourceLocation location) {
        if (arguments.size() >= 2) {
            for (AccessSet a : arguments) {
                if (a.hasAssignments()) {
                    throw TranslationException.sequencing("unsequenced assignment in call arguments", location);
                }
            }
        }
        check(arguments, location);
    }
}
