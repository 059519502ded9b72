package com.wangbin.reconciler.core.address;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * RTU目录
 * 由eTerra点表提取 RTU名 -> (RTU地址, 协议) 映射，供只有RTU名的数据源（自动测试、人工调试）推导地址。
 */
@Slf4j
public class RtuDirectory {

    private final Map<String, RtuEndpoint> endpoints;
    private final Set<String> warnedNames = ConcurrentHashMap.newKeySet();

    public RtuDirectory(Map<String, RtuEndpoint> endpoints) {
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    /**
     * 从点表构建，同名RTU以首次出现的记录为准
     */
    public static RtuDirectory fromPointTable(RowSet points) {
        Map<String, RtuEndpoint> endpoints = new LinkedHashMap<>();
        for (Row row : points.rows()) {
            String rtu = row.getString(ColumnNames.RTU);
            if (rtu == null) {
                continue;
            }
            endpoints.putIfAbsent(rtu, new RtuEndpoint(rtu,
                    row.getString(ColumnNames.RTU_ADDRESS), row.getString(ColumnNames.PROTOCOL)));
        }
        log.info("RTU目录构建完成: {} 个RTU", endpoints.size());
        return new RtuDirectory(endpoints);
    }

    /**
     * 按PowerOn侧RTU名解析，去掉名称中的 _RTU 后缀；未知RTU返回null并告警
     */
    public RtuEndpoint resolve(String poRtuName) {
        if (poRtuName == null) {
            return null;
        }
        String name = toEterraName(poRtuName);
        RtuEndpoint endpoint = endpoints.get(name);
        if (endpoint == null && warnedNames.add(name)) {
            log.warn("无法解析RTU地址与协议: {}", poRtuName);
        }
        return endpoint;
    }

    /**
     * 把测试记录中的控制地址（卡号:字地址:控制标识）解析为控制点通用地址；
     * 已是通用地址格式的原样返回，RTU无法解析或格式不符时返回null
     */
    public String resolveControlAddress(String poRtuName, String controlAddress) {
        if (AddressCodec.isBlank(controlAddress)) {
            return null;
        }
        String text = controlAddress.trim();
        if (text.startsWith("[")) {
            try {
                return GenericPointAddress.parse(text).format();
            } catch (IllegalArgumentException e) {
                log.warn("控制地址格式错误: {}", text);
                return null;
            }
        }
        String[] parts = text.split(":");
        if (parts.length < 3) {
            log.warn("控制地址格式错误，需为 卡号:字地址:控制标识: {}", text);
            return null;
        }
        RtuEndpoint endpoint = resolve(poRtuName);
        if (endpoint == null) {
            return null;
        }
        return AddressCodec.format(endpoint.rtuId(), parts[0].trim(), parts[1].trim(), parts[2].trim(),
                ReconcileConstant.TYPE_TAG_CONTROL);
    }

    public static String toEterraName(String poRtuName) {
        return poRtuName.replace(ReconcileConstant.PO_RTU_SUFFIX, "");
    }

    public int size() {
        return endpoints.size();
    }

    /**
     * RTU端点
     */
    public record RtuEndpoint(String rtu, String rtuAddress, String protocol) {

        public String rtuId() {
            return RtuId.format(rtu, rtuAddress);
        }
    }
}
