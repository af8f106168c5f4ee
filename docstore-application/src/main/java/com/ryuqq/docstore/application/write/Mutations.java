package com.ryuqq.docstore.application.write;

import com.ryuqq.docstore.core.exception.NotFoundException;
import com.ryuqq.docstore.core.model.CollectionName;
import com.ryuqq.docstore.core.model.Document;
import com.ryuqq.docstore.core.model.DocumentKeys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Mutation 팩토리.
 *
 * <p>각 Mutation은 최신 리비전에 다시 적용될 수 있도록 설계되었습니다:</p>
 * <ul>
 *   <li>insert: 같은 uid가 이미 있으면 그대로 두고, id가 충돌하면 max+1로 재할당</li>
 *   <li>update: 대상이 사라졌으면 {@link NotFoundException}</li>
 *   <li>delete: 대상이 사라졌으면 변경 없음</li>
 * </ul>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class Mutations {

    /**
     * 수정 시각 필드 이름.
     */
    public static final String UPDATED_AT = "updated_at";

    private static final Mutation NONE = current -> current;

    private Mutations() {
    }

    public static Mutation none() {
        return NONE;
    }

    /**
     * 레코드 추가.
     *
     * @param record id와 uid가 채워진 레코드
     * @return insert Mutation
     */
    public static Mutation insert(Document record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        String uid = record.getUid();
        return current -> {
            for (Document existing : current) {
                if (uid != null && uid.equals(existing.getUid())) {
                    return current;
                }
            }
            Document toAdd = record;
            long id = DocumentKeys.numericId(record.getId());
            for (Document existing : current) {
                if (DocumentKeys.numericId(existing.getId()) == id) {
                    toAdd = record.with(Document.ID, String.valueOf(DocumentKeys.nextId(current)));
                    break;
                }
            }
            List<Document> next = new ArrayList<>(current.size() + 1);
            next.addAll(current);
            next.add(toAdd);
            return Collections.unmodifiableList(next);
        };
    }

    /**
     * 첫 번째로 일치하는 레코드 수정.
     *
     * <p>id와 uid는 변경되지 않으며 {@code updated_at}이 기록됩니다.</p>
     *
     * @param collection 대상 컬렉션 (오류 메시지용)
     * @param key        id 또는 uid
     * @param updates    덮어쓸 필드
     * @param updatedAt  ISO-8601 타임스탬프
     * @param validator  병합된 레코드 검증 (스키마)
     * @return update Mutation
     */
    public static Mutation update(CollectionName collection, Object key, Map<String, ?> updates,
                                  String updatedAt, Consumer<Document> validator) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map<String, Object> changes = new LinkedHashMap<>();
        if (updates != null) {
            changes.putAll(updates);
        }
        changes.remove(Document.ID);
        changes.remove(Document.UID);
        changes.put(UPDATED_AT, updatedAt);
        return current -> {
            List<Document> next = new ArrayList<>(current);
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).matchesKey(key)) {
                    Document merged = next.get(i).merge(changes);
                    if (validator != null) {
                        validator.accept(merged);
                    }
                    next.set(i, merged);
                    return Collections.unmodifiableList(next);
                }
            }
            throw NotFoundException.forKey(collection.getValue(), key);
        };
    }

    /**
     * id 또는 uid가 일치하는 모든 레코드 삭제.
     *
     * @param key id 또는 uid
     * @return delete Mutation
     */
    public static Mutation delete(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return current -> {
            List<Document> next = new ArrayList<>(current.size());
            for (Document document : current) {
                if (!document.matchesKey(key)) {
                    next.add(document);
                }
            }
            return next.size() == current.size() ? current : Collections.unmodifiableList(next);
        };
    }
}
