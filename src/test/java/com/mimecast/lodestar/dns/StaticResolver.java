package com.mimecast.lodestar.dns;

import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Deterministic dnsjava resolver.
 * <p>Answers from a name and type keyed table without touching the network.
 * <br>Unknown questions get NXDOMAIN.
 */
public class StaticResolver extends SimpleResolver {

    private final Map<String, List<Record>> answers = new HashMap<>();
    private final Map<String, Integer> rcodes = new HashMap<>();

    public StaticResolver() {
        super(new InetSocketAddress(InetAddress.getLoopbackAddress(), 53));
    }

    public StaticResolver answer(Record record) {
        answers.computeIfAbsent(key(record.getName().toString(), record.getType()), k -> new ArrayList<>()).add(record);
        return this;
    }

    public StaticResolver rcode(String name, int type, int rcode) {
        rcodes.put(key(name, type), rcode);
        return this;
    }

    private static String key(String name, int type) {
        return name.toLowerCase() + "/" + Type.string(type);
    }

    @Override
    public Message send(Message query) {
        Record question = query.getQuestion();
        String key = key(question.getName().toString(), question.getType());

        Message response = new Message(query.getHeader().getID());
        response.getHeader().setFlag(Flags.QR);
        response.getHeader().setFlag(Flags.AA);
        response.addRecord(question, Section.QUESTION);

        if (rcodes.containsKey(key)) {
            response.getHeader().setRcode(rcodes.get(key));
        } else if (answers.containsKey(key)) {
            for (Record record : answers.get(key)) {
                response.addRecord(record, Section.ANSWER);
            }
        } else {
            response.getHeader().setRcode(Rcode.NXDOMAIN);
        }
        return response;
    }

    @Override
    public CompletionStage<Message> sendAsync(Message query) {
        return CompletableFuture.completedFuture(send(query));
    }

    @Override
    public CompletionStage<Message> sendAsync(Message query, Executor executor) {
        return CompletableFuture.completedFuture(send(query));
    }
}
