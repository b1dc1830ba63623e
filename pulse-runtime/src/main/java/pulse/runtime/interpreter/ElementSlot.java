package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.expr.IndexExpr;
import pulse.runtime.PulseArray;
import pulse.runtime.PulseValue;

/**
 * 已解析的数组元素位置：数组值和下标都只求值一次
 *
 * <p>多维下标的外层位置记在 parent 中。访问因违规被跳过时没有数组，
 * 读取得到占位值，写入不生效。</p>
 */
final class ElementSlot {

    final IndexExpr node;
    final PulseArray array;
    final int position;
    final ElementSlot parent;
    private final PulseValue fallback;

    ElementSlot(IndexExpr node, PulseArray array, int position, ElementSlot parent) {
        this(node, array, position, parent, null);
    }

    private ElementSlot(IndexExpr node, PulseArray array, int position, ElementSlot parent, PulseValue fallback) {
        this.node = node;
        this.array = array;
        this.position = position;
        this.parent = parent;
        this.fallback = fallback;
    }

    static ElementSlot skipped(IndexExpr node, PulseValue fallback) {
        return new ElementSlot(node, null, -1, null, fallback);
    }

    boolean isSkipped() {
        return array == null;
    }

    PulseValue get() {
        return isSkipped() ? fallback : array.get(position);
    }
}
