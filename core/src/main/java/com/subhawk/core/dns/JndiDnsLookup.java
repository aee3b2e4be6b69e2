package com.subhawk.core.dns;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JDK 내장 JNDI DNS 프로바이더로 CNAME 을 조회한다.
 * DirContext 는 스레드 세이프가 아니므로 질의마다 새로 열고 닫는다.
 */
public final class JndiDnsLookup implements DnsLookup {

    private static final Logger LOG = LoggerFactory.getLogger(JndiDnsLookup.class);
    private static final String FACTORY = "com.sun.jndi.dns.DnsContextFactory";

    private final String providerUrl;

    /** nameservers 가 비면 시스템 리졸버 설정 사용 */
    public JndiDnsLookup(List<String> nameservers) {
        this.providerUrl = providerUrl(nameservers);
    }

    /** ["8.8.8.8","1.1.1.1:53"] → "dns://8.8.8.8 dns://1.1.1.1:53" */
    static String providerUrl(List<String> nameservers) {
        if (nameservers == null || nameservers.isEmpty()) return "dns:";
        return nameservers.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> "dns://" + s)
                .collect(Collectors.joining(" "));
    }

    @Override
    public List<String> cname(String name, Duration timeout) throws DnsLookupException {
        DirContext ctx = null;
        try {
            ctx = new InitialDirContext(env(timeout));
            Attributes attrs = ctx.getAttributes(name, new String[]{"CNAME"});
            Attribute cname = (attrs == null) ? null : attrs.get("CNAME");
            List<String> out = new ArrayList<>();
            if (cname != null) {
                NamingEnumeration<?> values = cname.getAll();
                while (values.hasMore()) {
                    out.add(String.valueOf(values.next()));
                }
            }
            return out;
        } catch (NamingException e) {
            throw classify(name, e);
        } finally {
            if (ctx != null) {
                try { ctx.close(); }
                catch (NamingException e) { LOG.debug("DirContext close failed: {}", e.toString()); }
            }
        }
    }

    /** JNDI 예외 → NXDOMAIN / TIMEOUT / ERROR. 통신 오류는 root cause 로 가른다 */
    static DnsLookupException classify(String name, NamingException e) {
        if (e instanceof NameNotFoundException) {
            return new DnsLookupException(DnsLookupException.Kind.NXDOMAIN, "name not found: " + name, e);
        }
        if (e instanceof CommunicationException) {
            Throwable root = e.getRootCause();
            if (root == null || root instanceof SocketTimeoutException) {
                return new DnsLookupException(DnsLookupException.Kind.TIMEOUT, "no DNS response for " + name, e);
            }
            return new DnsLookupException(DnsLookupException.Kind.ERROR, String.valueOf(root.getMessage()), e);
        }
        return new DnsLookupException(DnsLookupException.Kind.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }

    private Hashtable<String, String> env(Duration timeout) {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, FACTORY);
        env.put(Context.PROVIDER_URL, providerUrl);
        // 재시도 없이 한 번만 기다린다 → 질의당 대기 상한 = timeout
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");
        return env;
    }
}
