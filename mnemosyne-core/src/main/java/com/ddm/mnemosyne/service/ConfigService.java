package com.ddm.mnemosyne.service;

import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigDefinition;
import com.ddm.mnemosyne.defined.ConfigView;
import com.ddm.mnemosyne.defined.HistoryPage;
import com.ddm.mnemosyne.defined.ImportResult;
import com.ddm.mnemosyne.defined.ListFilter;
import com.ddm.mnemosyne.defined.UpdateResult;

import java.util.List;
import java.util.Map;

/**
 * 配置中心对外接口。
 *
 * <p><strong>写操作：</strong>
 * {@link #update}、{@link #rollback}、{@link #resetToDefault} 在同一个 Key 上串行执行，
 * 每次在一个事务中同时写入当前值与历史记录，提交后失效缓存并通知监听器。
 * 提交前的任何失败都不会留下部分写入。
 *
 * <p><strong>读操作：</strong>
 * {@link #get} 与 {@link #getValue} 经过缓存；{@link #list} 与 {@link #history} 直接读取存储。
 * 面向展示的结果中加密配置一律遮蔽，只有 {@link #getValue} 返回明文。
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigService {

    int DEFAULT_HISTORY_LIMIT = 20;

    /**
     * 按条件列出配置，按分类、sortOrder、名称排序。无匹配时返回空列表。
     */
    List<ConfigView> list(ListFilter filter);

    /**
     * 同 {@link #list}，按分类分组；没有配置的分类对应空列表。
     */
    Map<ConfigCategory, List<ConfigView>> listGrouped(ListFilter filter);

    /**
     * @throws com.ddm.mnemosyne.exception.NotFoundException 配置不存在
     */
    ConfigView get(String key);

    /**
     * 运行时读取解密并转换后的配置值。
     *
     * @return 转换后的值；配置为空值时返回 null
     * @throws com.ddm.mnemosyne.exception.NotFoundException 配置不存在
     */
    <T> T getValue(String key, Class<T> type);

    /**
     * 运行时读取配置值，配置不存在或为空值时返回 fallback。
     */
    <T> T getValue(String key, Class<T> type, T fallback);

    /**
     * 校验并写入新值。
     *
     * @param key    配置键
     * @param value  候选值（字符串或已解析的类型化值）
     * @param actor  操作者
     * @param reason 变更原因，可以为 null
     * @throws com.ddm.mnemosyne.exception.NotFoundException             配置不存在
     * @throws com.ddm.mnemosyne.exception.ReadOnlyViolationException    只读配置
     * @throws com.ddm.mnemosyne.exception.ValidationException           校验失败
     * @throws com.ddm.mnemosyne.exception.ConcurrencyConflictException 并发写入冲突
     */
    UpdateResult update(String key, Object value, String actor, String reason);

    /**
     * 恢复到某条历史记录变更前的值，并追加一条新的回滚记录。
     * <p>
     * 即使恢复的值与当前值相同也会追加记录。
     *
     * @param historyId 目标历史记录 ID，必须属于该配置
     * @param reason    为 null 时使用 "Rolled back to version N"
     * @throws com.ddm.mnemosyne.exception.HistoryMismatchException 历史记录不存在或不属于该配置
     */
    UpdateResult rollback(String key, String historyId, String actor, String reason);

    default UpdateResult rollback(String key, String historyId, String actor) {
        return rollback(key, historyId, actor, null);
    }

    /**
     * 重置为默认值。当前值已是默认值时不做任何变更，{@link UpdateResult#changed()} 为 false。
     */
    UpdateResult resetToDefault(String key, String actor, String reason);

    default UpdateResult resetToDefault(String key, String actor) {
        return resetToDefault(key, actor, null);
    }

    /**
     * 丢弃全部缓存，下次读取时从存储重建。不写历史。
     */
    void reload();

    /**
     * 分页读取历史，最近的在前。
     *
     * @throws com.ddm.mnemosyne.exception.NotFoundException 配置不存在
     */
    HistoryPage history(String key, int limit, int offset);

    default HistoryPage history(String key) {
        return history(key, DEFAULT_HISTORY_LIMIT, 0);
    }

    /**
     * 预置配置项，当前值取默认值，版本号为 1，不写历史。
     *
     * @throws com.ddm.mnemosyne.exception.ConfigAlreadyExistsException 键已存在
     */
    ConfigView provision(ConfigDefinition definition);

    /**
     * 导出所有非加密配置的当前值。
     */
    Map<String, Object> exportValues();

    /**
     * 批量导入：未知、加密与只读配置被跳过，单项失败不影响其他项。
     */
    ImportResult importValues(Map<String, ?> values, String actor);

    /**
     * 校验某个配置的历史链是否连续。
     *
     * @throws com.ddm.mnemosyne.exception.NotFoundException 配置不存在
     */
    boolean verifyHistory(String key);
}
