package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.config.ReconcilerProperties.CommissioningConfig;
import com.wangbin.reconciler.core.config.ReconcilerProperties.DuplicatePolicy;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.AliasSubstitutions;
import com.wangbin.reconciler.core.merge.JoinSupport;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.merge.MergeInputs;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 控制挂接
 * 可控点按别名查找最多2个控制，模拟量按别名查找设定值控制；
 * 再按控制地址补充匹配状态、台账配置、三项人工调试结果和自动测试状态，并汇总调试通过数。
 */
@Slf4j
public class ControlAttachStage extends AbstractMergeStage {

    static final String ADDR = "Addr";
    static final String NAME = "Name";
    static final String MATCH_STATUS = "MatchStatus";
    static final String CONFIG_HEALTH = "ConfigHealth";
    static final String TELECONTROL_ACTION = "TelecontrolAction";
    static final String VISUAL_CHECK = "VisualCheck";
    static final String CONTROL_SENT = "ControlSent";
    static final String ACTION_VERIFIED = "ActionVerified";
    static final String TEST_RESULT = "TestResult";
    static final String AUTO_TEST_STATUS = "AutoTestStatus";

    private static final List<String> PER_CONTROL_SUFFIXES = List.of(
            ADDR, NAME, MATCH_STATUS, CONFIG_HEALTH, TELECONTROL_ACTION,
            VISUAL_CHECK, CONTROL_SENT, ACTION_VERIFIED, TEST_RESULT, AUTO_TEST_STATUS);

    public ControlAttachStage() {
        super("control_attach", 60);
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        ControlLookups lookups = ControlLookups.build(context.getInputs(),
                context.getMergeConfig().getDuplicateInventoryPolicy());
        AliasSubstitutions substitutions =
                new AliasSubstitutions(context.getMergeConfig().getAliasSubstitutions());
        CommissioningConfig commissioning = context.getCommissioningConfig();

        List<String> added = new ArrayList<>();
        for (int n = 1; n <= ReconcileConstant.MAX_CONTROLS; n++) {
            for (String suffix : PER_CONTROL_SUFFIXES) {
                added.add(ColumnNames.ctrl(n, suffix));
            }
        }
        added.add(ColumnNames.NUM_CONTROLS);
        added.add(ColumnNames.NUM_CONTROLS_COMMISSION_OK);
        added.add(ColumnNames.NUM_CONTROLS_ALL_COMMISSION_OK);
        added.add(ColumnNames.PERCENT_CONTROLS_COMMISSION_OK);
        added.add(ColumnNames.PERCENT_CONTROLS_ALL_COMMISSION_OK);

        int[] withControls = {0};
        RowSet result = input.mapRows(added, row -> {
            Map<String, Object> values = attach(row, lookups, substitutions, commissioning);
            if ((Long) values.get(ColumnNames.NUM_CONTROLS) > 0) {
                withControls[0]++;
            }
            return row.withAll(values);
        });
        log.info("控制挂接完成: {} 行带控制, 控制表 {} 行, 设定值表 {} 行",
                withControls[0], context.getInputs().getControls().size(), context.getInputs().getSetpoints().size());
        return result;
    }

    private Map<String, Object> attach(Row row, ControlLookups lookups, AliasSubstitutions substitutions,
                                       CommissioningConfig commissioning) {
        String[] addresses = new String[ReconcileConstant.MAX_CONTROLS];
        String[] names = new String[ReconcileConstant.MAX_CONTROLS];
        for (int i = 0; i < ReconcileConstant.MAX_CONTROLS; i++) {
            addresses[i] = "";
            names[i] = "";
        }

        if (ReconcileConstant.CONTROLLABLE_YES.equals(row.getString(ColumnNames.CONTROLLABLE))) {
            String alias = substitutions.controlAlias(row);
            List<Row> controls = alias != null ? lookups.controlsByAlias.getOrDefault(alias, List.of()) : List.of();
            if (controls.size() > ReconcileConstant.MAX_CONTROLS) {
                log.warn("别名 {} 有 {} 个控制，只挂接前 {} 个", alias, controls.size(), ReconcileConstant.MAX_CONTROLS);
            }
            for (int i = 0; i < Math.min(controls.size(), ReconcileConstant.MAX_CONTROLS); i++) {
                addresses[i] = controls.get(i).getStringOrEmpty(ColumnNames.GENERIC_POINT_ADDRESS);
                names[i] = controls.get(i).getStringOrEmpty(ColumnNames.CONTROL_ID);
            }
        }
        if (ReconcileConstant.TYPE_ANALOG.equals(row.getString(ColumnNames.GENERIC_TYPE))) {
            String alias = row.getString(ColumnNames.ETERRA_ALIAS);
            List<Row> setpoints = alias != null ? lookups.setpointsByAlias.getOrDefault(alias, List.of()) : List.of();
            if (!setpoints.isEmpty()) {
                addresses[0] = setpoints.get(0).getStringOrEmpty(ColumnNames.GENERIC_POINT_ADDRESS);
                names[0] = ReconcileConstant.SETPOINT_CONTROL_NAME;
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        long numControls = 0;
        long commissionOk = 0;
        long allCommissionOk = 0;
        String passing = commissioning.getPassingResult();
        for (int i = 0; i < ReconcileConstant.MAX_CONTROLS; i++) {
            int n = i + 1;
            String address = addresses[i];
            values.put(ColumnNames.ctrl(n, ADDR), address);
            values.put(ColumnNames.ctrl(n, NAME), names[i]);
            if (address.isEmpty()) {
                for (String suffix : PER_CONTROL_SUFFIXES.subList(2, PER_CONTROL_SUFFIXES.size())) {
                    values.put(ColumnNames.ctrl(n, suffix), null);
                }
                continue;
            }
            numControls++;

            Row inventory = lookups.inventoryByAddress.get(address);
            Row autoTest = lookups.autoTestByAddress.get(address);
            Map<String, Object> tests = lookups.commissioningByAddress.getOrDefault(address, Map.of());
            Object visualCheck = tests.get(commissioning.getVisualCheckTest());
            Object controlSent = tests.get(commissioning.getControlSentTest());
            Object actionVerified = tests.get(commissioning.getActionVerifiedTest());

            values.put(ColumnNames.ctrl(n, MATCH_STATUS), lookups.compareStatusByAddress.get(address));
            values.put(ColumnNames.ctrl(n, CONFIG_HEALTH), inventory != null ? inventory.get(ColumnNames.CONFIG_HEALTH) : null);
            values.put(ColumnNames.ctrl(n, TELECONTROL_ACTION), inventory != null ? inventory.get(ColumnNames.TC_ACTION) : null);
            values.put(ColumnNames.ctrl(n, VISUAL_CHECK), visualCheck);
            values.put(ColumnNames.ctrl(n, CONTROL_SENT), controlSent);
            values.put(ColumnNames.ctrl(n, ACTION_VERIFIED), actionVerified);
            values.put(ColumnNames.ctrl(n, TEST_RESULT), actionVerified);
            values.put(ColumnNames.ctrl(n, AUTO_TEST_STATUS), autoTest != null ? autoTest.get(ColumnNames.AUTO_TEST_STATUS) : null);

            boolean verified = passing.equals(stringOf(actionVerified));
            if (verified) {
                commissionOk++;
                if (passing.equals(stringOf(visualCheck)) && passing.equals(stringOf(controlSent))) {
                    allCommissionOk++;
                }
            }
        }

        values.put(ColumnNames.NUM_CONTROLS, numControls);
        values.put(ColumnNames.NUM_CONTROLS_COMMISSION_OK, commissionOk);
        values.put(ColumnNames.NUM_CONTROLS_ALL_COMMISSION_OK, allCommissionOk);
        values.put(ColumnNames.PERCENT_CONTROLS_COMMISSION_OK, percent(commissionOk, numControls));
        values.put(ColumnNames.PERCENT_CONTROLS_ALL_COMMISSION_OK, percent(allCommissionOk, numControls));
        return values;
    }

    private static Double percent(long count, long total) {
        return total == 0 ? null : count * 100.0 / total;
    }

    private static String stringOf(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * 控制挂接所需的查找表，每次合并只构建一次
     */
    static final class ControlLookups {

        private final Map<String, List<Row>> controlsByAlias;
        private final Map<String, List<Row>> setpointsByAlias;
        private final Map<String, Object> compareStatusByAddress = new HashMap<>();
        private final Map<String, Row> inventoryByAddress;
        private final Map<String, Row> autoTestByAddress = new HashMap<>();
        // 地址 -> 测试名 -> 最近一次结果
        private final Map<String, Map<String, Object>> commissioningByAddress = new HashMap<>();

        private ControlLookups(MergeInputs inputs, DuplicatePolicy duplicatePolicy) {
            this.controlsByAlias = JoinSupport.index(inputs.getControls(), ColumnNames.ETERRA_ALIAS);
            this.setpointsByAlias = JoinSupport.index(inputs.getSetpoints(), ColumnNames.ETERRA_ALIAS);
            JoinSupport.index(inputs.getHabddeCompare(), ColumnNames.GENERIC_POINT_ADDRESS)
                    .forEach((address, rows) -> compareStatusByAddress.put(address,
                            rows.get(0).get(ColumnNames.HABDDE_COMPARE_STATUS)));
            this.inventoryByAddress = JoinSupport.uniqueIndex(inputs.getInventory(),
                    ColumnNames.GENERIC_POINT_ADDRESS, "control_attach/inventory",
                    InventoryJoinStage.duplicateHandler(duplicatePolicy));
            JoinSupport.index(inputs.getAutoTests(), ColumnNames.GENERIC_POINT_ADDRESS)
                    .forEach((address, rows) -> autoTestByAddress.put(address, rows.get(0)));
            JoinSupport.index(inputs.getCommissioning(), ColumnNames.GENERIC_POINT_ADDRESS)
                    .forEach((address, rows) -> commissioningByAddress.put(address, latestResults(rows)));
        }

        static ControlLookups build(MergeInputs inputs, DuplicatePolicy duplicatePolicy) {
            return new ControlLookups(inputs, duplicatePolicy);
        }

        /**
         * 每个测试名取测试日期最近的一条结果，日期相同时取后出现的
         */
        private static Map<String, Object> latestResults(List<Row> tests) {
            Map<String, Row> latest = new HashMap<>();
            for (Row test : tests) {
                String testName = test.getString(ColumnNames.COMMISSIONING_TEST_NAME);
                if (testName == null) {
                    continue;
                }
                Row current = latest.get(testName);
                if (current == null || compareDates(test.get(ColumnNames.COMMISSIONING_TEST_DATE),
                        current.get(ColumnNames.COMMISSIONING_TEST_DATE)) >= 0) {
                    latest.put(testName, test);
                }
            }
            Map<String, Object> results = new HashMap<>();
            latest.forEach((name, test) -> results.put(name, test.get(ColumnNames.COMMISSIONING_RESULT)));
            return results;
        }

        private static int compareDates(Object a, Object b) {
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : -1) : 1;
            }
            if (a instanceof Number x && b instanceof Number y) {
                return Double.compare(x.doubleValue(), y.doubleValue());
            }
            return a.toString().compareTo(b.toString());
        }
    }
}
