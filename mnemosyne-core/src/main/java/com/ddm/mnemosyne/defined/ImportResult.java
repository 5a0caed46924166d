package com.ddm.mnemosyne.defined;

import java.util.List;

/**
 * 批量导入结果。
 *
 * @param imported 成功导入数
 * @param skipped  跳过数（未知键、加密或只读配置）
 * @param errors   失败明细，格式 {@code key: reason}
 */
public record ImportResult(int imported, int skipped, List<String> errors) {

    public ImportResult {
        errors = List.copyOf(errors);
    }
}
