package cn.bafuka.selfrecall.core;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * SessionId 单元测试
 */
public class SessionIdTest {

    @Test
    public void testUnifiedOrigin() {
        assertEquals("qq:GroupMessage:100", SessionId.group("qq", "100").unifiedOrigin());
        assertEquals("qq:PrivateMessage:10001", SessionId.privateChat("qq", "10001").unifiedOrigin());
    }

    @Test
    public void testParse() {
        SessionId session = SessionId.parse("aiocqhttp:GroupMessage:123456");

        assertEquals("aiocqhttp", session.getPlatform());
        assertEquals(ChatType.GROUP, session.getChatType());
        assertEquals("123456", session.groupId());
        assertEquals(SessionId.group("aiocqhttp", "123456"), session);
    }

    /**
     * 同号的私聊和群聊是不同会话
     */
    @Test
    public void testEquality_ChatTypeMatters() {
        SessionId group = SessionId.group("qq", "100");
        SessionId direct = SessionId.privateChat("qq", "100");

        assertNotEquals(group, direct);
        assertNull(direct.groupId());
        assertEquals(group.hashCode(), SessionId.group("qq", "100").hashCode());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParse_UnknownType() {
        SessionId.parse("qq:FriendMessage:100");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParse_MissingId() {
        SessionId.parse("qq:GroupMessage:");
    }
}
