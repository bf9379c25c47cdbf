package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.aggregates.uow.BagStore;
import io.github.goodees.aggregates.uow.BagStoreException;
import io.github.goodees.aggregates.uow.ContextBag;
import io.github.goodees.aggregates.uow.SavedBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bag store keeping bags as JSON in table <em>bagTable</em>(MESSAGE_ID, KIND, PAYLOAD) primary key
 * (MESSAGE_ID, KIND).
 */
public class JdbcBagStore implements BagStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcBagStore.class);
    private static final TypeReference<Map<String, Object>> ENTRIES = new TypeReference<Map<String, Object>>() {
    };

    private final DataSource dataSource;
    private final String bagTable;
    private final ObjectMapper mapper;
    private final TxHandler txHandler;

    public JdbcBagStore(DataSource dataSource, String bagTable) {
        this(dataSource, bagTable, ObjectMappers.create(), TxHandler.LOCAL);
    }

    public JdbcBagStore(DataSource dataSource, String bagTable, ObjectMapper mapper, TxHandler txHandler) {
        this.dataSource = dataSource;
        this.bagTable = bagTable;
        this.mapper = mapper;
        this.txHandler = txHandler;
    }

    @Override
    public List<SavedBag> remove(String messageId) throws BagStoreException {
        List<SavedBag> result = new ArrayList<>();
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                try (PreparedStatement select = connection.prepareStatement("SELECT KIND, PAYLOAD FROM " + bagTable
                        + " WHERE MESSAGE_ID=? FOR UPDATE")) {
                    select.setString(1, messageId);
                    try (ResultSet rs = select.executeQuery()) {
                        while (rs.next()) {
                            result.add(new SavedBag(messageId, rs.getString(1), readBag(rs.getString(2))));
                        }
                    }
                }
                try (PreparedStatement delete = connection.prepareStatement("DELETE FROM " + bagTable
                        + " WHERE MESSAGE_ID=?")) {
                    delete.setString(1, messageId);
                    delete.executeUpdate();
                }
                txHandler.commit(connection);
                logger.debug("Removed {} bags of message {}", result.size(), messageId);
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException | JsonProcessingException | RuntimeException e) {
            throw BagStoreException.removeFailed(messageId, e);
        }
        return result;
    }

    @Override
    public void save(String messageId, String kind, ContextBag bag) throws BagStoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                String payload = mapper.writeValueAsString(bag.asMap());
                int updated;
                try (PreparedStatement update = connection.prepareStatement("UPDATE " + bagTable
                        + " SET PAYLOAD=? WHERE MESSAGE_ID=? AND KIND=?")) {
                    update.setString(1, payload);
                    update.setString(2, messageId);
                    update.setString(3, kind);
                    updated = update.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement insert = connection.prepareStatement("INSERT INTO " + bagTable
                            + " (MESSAGE_ID, KIND, PAYLOAD) VALUES (?,?,?)")) {
                        insert.setString(1, messageId);
                        insert.setString(2, kind);
                        insert.setString(3, payload);
                        insert.executeUpdate();
                    }
                }
                txHandler.commit(connection);
                logger.debug("Saved bag {} of message {}", kind, messageId);
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException | JsonProcessingException | RuntimeException e) {
            throw BagStoreException.saveFailed(messageId, kind, e);
        }
    }

    private ContextBag readBag(String payload) throws JsonProcessingException {
        return new ContextBag(mapper.readValue(payload, ENTRIES));
    }
}
