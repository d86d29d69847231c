package cn.bafuka.selfrecall.spi;

import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.spi.impl.NacosConfigSource;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.nacos.api.config.ConfigService;
import com.alibaba.nacos.api.config.listener.Listener;
import com.alibaba.nacos.api.exception.NacosException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * NacosConfigSource 单元测试
 * ConfigService 使用 mock，不连接真实 Nacos
 */
public class NacosConfigSourceTest {

    private static final String DATA_ID = "self-recall.json";

    private static final String GROUP = "DEFAULT_GROUP";

    @Mock
    private ConfigService configService;

    private NacosConfigSource source;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        source = new NacosConfigSource(configService, DATA_ID, GROUP);
    }

    /**
     * 订阅时加载当前配置，之后的推送同样生效
     */
    @Test
    public void testSubscribe_LoadsAndListens() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{\"groupRecallTime\":50}");
        List<RecallPolicyConfig> received = new ArrayList<>();

        source.subscribe(received::add);

        ArgumentCaptor<Listener> captor = ArgumentCaptor.forClass(Listener.class);
        verify(configService).addListener(eq(DATA_ID), eq(GROUP), captor.capture());
        assertEquals(1, received.size());
        assertEquals(50, received.get(0).getGroupRecallTime());

        captor.getValue().receiveConfigInfo("{\"groupRecallTime\":70}");
        assertEquals(2, received.size());
        assertEquals(70, received.get(1).getGroupRecallTime());

        // 空内容不覆盖当前配置
        captor.getValue().receiveConfigInfo("");
        assertEquals(2, received.size());
    }

    /**
     * Nacos 中尚未发布配置时推送默认策略
     */
    @Test
    public void testSubscribe_EmptyInitialConfigUsesDefaults() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn(null);
        List<RecallPolicyConfig> received = new ArrayList<>();

        source.subscribe(received::add);

        assertEquals(1, received.size());
        assertEquals(RecallPolicyConfig.defaults(), received.get(0));
    }

    @Test
    public void testSaveWhitelist_PublishesJson() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{\"groupRecallTime\":50}");
        when(configService.publishConfig(eq(DATA_ID), eq(GROUP), anyString())).thenReturn(true);

        source.saveWhitelist(Collections.singleton("100"));

        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        verify(configService).publishConfig(eq(DATA_ID), eq(GROUP), content.capture());
        JSONObject published = JSON.parseObject(content.getValue());
        assertEquals(Collections.singletonList("100"),
                published.getJSONArray("groupWhitelist").toJavaList(String.class));
        assertEquals(50, published.getIntValue("groupRecallTime"));
    }

    @Test
    public void testSaveWhitelist_PublishFailure() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{}");
        when(configService.publishConfig(eq(DATA_ID), eq(GROUP), anyString()))
                .thenThrow(new NacosException(NacosException.SERVER_ERROR, "unavailable"));

        try {
            source.saveWhitelist(Collections.singleton("100"));
            fail("Expected CONFIG_ERROR");
        } catch (RecallException e) {
            assertEquals(RecallException.Reason.CONFIG_ERROR, e.getReason());
        }
    }

    @Test
    public void testShutdown_RemovesListener() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{}");
        source.subscribe(config -> { });

        source.shutdown();

        verify(configService).removeListener(eq(DATA_ID), eq(GROUP), any(Listener.class));
    }
}
