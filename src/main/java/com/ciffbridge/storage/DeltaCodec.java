package com.ciffbridge.storage;

import com.ciffbridge.error.InvalidFormatException;

/**
 * Delta编码器
 * 
 * 用于文档ID序列在绝对值与相邻差值之间互转。
 * CIFF 倒排中每个 posting 存储与前一个 docid 的差值（首个为绝对值），
 * PISA 二进制集合则存储绝对 docid。
 * 
 * 示例：[10, 15, 20, 25] <-> [10, 5, 5, 5]
 */
public final class DeltaCodec {
    
    /** u32 能表示的最大值 */
    private static final long MAX_U32 = 0xFFFF_FFFFL;
    
    private DeltaCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 将严格递增的绝对 docid 序列转为差值序列
     * 
     * @param sortedValues 严格递增的绝对值（按无符号32位解释）
     * @return Delta编码后的数组
     * @throws InvalidFormatException 如果输入非严格递增
     */
    public static int[] encode(int[] sortedValues) {
        if (sortedValues == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        if (sortedValues.length == 0) {
            return new int[0];
        }
        
        int[] deltas = new int[sortedValues.length];
        deltas[0] = sortedValues[0]; // 第一个值保持原样
        
        for (int i = 1; i < sortedValues.length; i++) {
            long previous = Integer.toUnsignedLong(sortedValues[i - 1]);
            long current = Integer.toUnsignedLong(sortedValues[i]);
            if (current <= previous) {
                throw new InvalidFormatException(
                    "docid 必须严格递增，在位置 " + i + " 处违反: previous=" + previous + ", current=" + current);
            }
            deltas[i] = (int) (current - previous);
        }
        
        return deltas;
    }
    
    /**
     * 对差值序列做前缀和还原绝对值
     * 
     * @param deltas Delta编码后的数组（首个为绝对值）
     * @return 还原后的原始序列
     * @throws InvalidFormatException 如果差值为负或前缀和超出u32范围
     */
    public static int[] decode(int[] deltas) {
        if (deltas == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        
        int[] values = new int[deltas.length];
        long current = 0;
        for (int i = 0; i < deltas.length; i++) {
            current = accumulate(current, deltas[i], i);
            values[i] = (int) current;
        }
        
        return values;
    }
    
    /**
     * 将一个差值累加到当前绝对值上
     * 
     * @param current 当前绝对值
     * @param delta 差值（CIFF 中为有符号 int32）
     * @param position 差值所在位置，用于错误消息
     * @return 新的绝对值
     * @throws InvalidFormatException 如果差值为负或结果超出u32范围
     */
    public static long accumulate(long current, int delta, int position) {
        if (delta < 0) {
            throw new InvalidFormatException("docid 差值不能为负数，位置=" + position + ", delta=" + delta);
        }
        long next = current + delta;
        if (next > MAX_U32) {
            throw new InvalidFormatException("docid 超出u32范围，位置=" + position + ", value=" + next);
        }
        return next;
    }
}
