package personal.ai.calendar.scheduling.adapter.out.store;

/**
 * 정렬 키 범위 [lower, upper] 또는 [lower, upper)
 */
public record SortKeyRange(String lower, String upper, boolean upperInclusive) {

    public SortKeyRange {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Sort key bounds cannot be null");
        }
    }

    /**
     * prefix로 시작하는 모든 키
     */
    public static SortKeyRange prefix(String prefix) {
        return spanning(prefix, prefix);
    }

    /**
     * lower 이상 upper 이하 (양 끝 포함)
     */
    public static SortKeyRange between(String lower, String upper) {
        return new SortKeyRange(lower, upper, true);
    }

    /**
     * lowerPrefix로 시작하는 첫 키부터 upperPrefix로 시작하는 마지막 키까지
     */
    public static SortKeyRange spanning(String lowerPrefix, String upperPrefix) {
        return new SortKeyRange(lowerPrefix, successor(upperPrefix), false);
    }

    // 마지막 문자를 1 증가시킨 문자열: prefix로 시작하는 모든 키보다 크다
    private static String successor(String prefix) {
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("Prefix cannot be empty");
        }
        int last = prefix.length() - 1;
        return prefix.substring(0, last) + (char) (prefix.charAt(last) + 1);
    }
}
