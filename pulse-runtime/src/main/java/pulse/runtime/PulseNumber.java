package pulse.runtime;

/**
 * 数值类型标记接口
 */
public interface PulseNumber {

    double asDouble();
}
