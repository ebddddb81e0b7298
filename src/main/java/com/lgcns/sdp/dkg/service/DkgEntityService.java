package com.lgcns.sdp.dkg.service;

import com.lgcns.sdp.dkg.exception.InvalidQueryException;
import com.lgcns.sdp.dkg.repository.DkgNodeRepository;
import com.lgcns.sdp.dkg.util.GraphRecordUtil;
import com.lgcns.sdp.dkg.util.StoreExceptionTranslator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class DkgEntityService {

    private final DkgNodeRepository dkgNodeRepository;
    private final GraphRecordUtil graphRecordUtil;

    public Optional<Map<String, Object>> lookupEntity(String curie) {
        return lookupEntities(List.of(curie)).stream().findFirst();
    }

    /**
     * 요청한 CURIE 순서대로, 저장소에 있는 노드만 돌려준다.
     */
    public List<Map<String, Object>> lookupEntities(List<String> curies) {
        Set<String> requested = new LinkedHashSet<>();
        for (String curie : curies) {
            if (curie == null || curie.isBlank()) {
                throw new InvalidQueryException("curie", "must not be blank");
            }
            requested.add(curie.trim());
        }

        List<Map<String, Object>> nodes;
        try {
            nodes = dkgNodeRepository.findByCuries(requested);
        } catch (RuntimeException e) {
            throw StoreExceptionTranslator.translate(e, "Entity lookup");
        }

        Map<Object, Map<String, Object>> byCurie = new LinkedHashMap<>();
        nodes.forEach(node -> byCurie.putIfAbsent(node.get(GraphRecordUtil.ID), node));

        return requested.stream()
                .filter(byCurie::containsKey)
                .map(curie -> graphRecordUtil.hydrateNode(byCurie.get(curie)))
                .toList();
    }
}
