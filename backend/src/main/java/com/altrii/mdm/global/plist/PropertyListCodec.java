package com.altrii.mdm.global.plist;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.altrii.mdm.global.error.MdmErrorCode;
import com.altrii.mdm.global.error.MdmException;
import com.dd.plist.NSArray;
import com.dd.plist.NSData;
import com.dd.plist.NSDate;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.dd.plist.PropertyListParser;

import org.springframework.stereotype.Component;

/**
 * Converts between Apple property lists (the wire format of the check-in, command and
 * profile documents) and plain Java maps, lists and scalars.
 */
@Component
public class PropertyListCodec {

    public Map<String, Object> decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Empty property list");
        }
        NSObject root;
        try {
            root = PropertyListParser.parse(body);
        } catch (Exception ex) {
            throw new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Unreadable property list: " + ex.getMessage());
        }
        if (!(root instanceof NSDictionary dictionary)) {
            throw new MdmException(MdmErrorCode.MALFORMED_PAYLOAD, "Property list root must be a dictionary");
        }
        return toMap(dictionary);
    }

    public byte[] encode(Map<String, ?> document) {
        return toXml(document).getBytes(StandardCharsets.UTF_8);
    }

    public String toXml(Map<String, ?> document) {
        return toDictionary(document).toXMLPropertyList();
    }

    private Map<String, Object> toMap(NSDictionary dictionary) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, NSObject> entry : dictionary.entrySet()) {
            result.put(entry.getKey(), toJava(entry.getValue()));
        }
        return result;
    }

    private Object toJava(NSObject value) {
        if (value == null) {
            return null;
        }
        if (value instanceof NSDictionary dictionary) {
            return toMap(dictionary);
        }
        if (value instanceof NSArray array) {
            List<Object> items = new ArrayList<>(array.count());
            for (NSObject item : array.getArray()) {
                items.add(toJava(item));
            }
            return items;
        }
        if (value instanceof NSString string) {
            return string.getContent();
        }
        if (value instanceof NSNumber number) {
            if (number.isBoolean()) {
                return number.boolValue();
            }
            if (number.isInteger()) {
                return number.longValue();
            }
            return number.doubleValue();
        }
        if (value instanceof NSData data) {
            return data.bytes();
        }
        if (value instanceof NSDate date) {
            return date.getDate();
        }
        return value.toString();
    }

    private NSDictionary toDictionary(Map<String, ?> map) {
        NSDictionary dictionary = new NSDictionary();
        map.forEach((key, value) -> {
            if (value != null) {
                dictionary.put(key, toNative(value));
            }
        });
        return dictionary;
    }

    @SuppressWarnings("unchecked")
    private NSObject toNative(Object value) {
        if (value instanceof NSObject nsObject) {
            return nsObject;
        }
        if (value instanceof Map<?, ?> map) {
            return toDictionary((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            NSObject[] items = collection.stream()
                    .filter(item -> item != null)
                    .map(this::toNative)
                    .toArray(NSObject[]::new);
            return new NSArray(items);
        }
        if (value instanceof Boolean bool) {
            return new NSNumber(bool);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new NSNumber(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return new NSNumber(number.doubleValue());
        }
        if (value instanceof byte[] bytes) {
            return new NSData(bytes);
        }
        if (value instanceof Date date) {
            return new NSDate(date);
        }
        if (value instanceof Enum<?> enumValue) {
            return new NSString(enumValue.name());
        }
        if (value instanceof UUID || value instanceof CharSequence) {
            return new NSString(value.toString());
        }
        throw new IllegalArgumentException("Unsupported property list value: " + value.getClass().getName());
    }
}
