package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ColumnInfo;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.QueryResult;
import com.example.dbjobs.dto.TableInfo;
import com.example.dbjobs.dto.TableSchema;
import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.exception.ConnectionException;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.json.JsonParseException;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB 连接器：schema 对应 database，table 对应 collection
 * <p>
 * executeQuery 接收 JSON 查询对象:
 * <pre>
 * {"collection": "users", "operation": "find", "filter": {"age": {"$gt": 18}},
 *  "projection": {"name": 1}, "sort": {"name": 1}, "skip": 0, "limit": 100}
 * </pre>
 * operation 支持 find / aggregate(pipeline) / count / distinct(field)
 */
@Slf4j
public class MongoConnector implements Connector {
    static final int DEFAULT_LIMIT = 100;
    static final int SCHEMA_SAMPLE_SIZE = 10;

    private final ConnectionTarget target;
    private final String databaseName;

    private MongoClient client;
    private MongoDatabase database;
    private ClientSession transactionSession;

    public MongoConnector(ConnectionTarget target) {
        this.target = target;
        String fromUri = null;
        if (StringUtils.isNotBlank(target.getUrl())) {
            try {
                fromUri = new ConnectionString(target.getUrl()).getDatabase();
            } catch (IllegalArgumentException e) {
                log.warn("MongoDB URI 解析失败，稍后连接时报错: {}", e.getMessage());
            }
        }
        // URI 里没带库名时退回 admin，仍可用于列库等管理操作
        this.databaseName = StringUtils.firstNonBlank(fromUri, target.getDatabase(), "admin");
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MONGODB;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    @Override
    public synchronized void connect() {
        if (client != null) {
            return;
        }
        if (StringUtils.isBlank(target.getUrl())) {
            throw new ConnectionException("MongoDB connection URI is empty");
        }
        try {
            int timeoutMs = Math.max(1, target.getTimeoutSeconds()) * 1000;
            MongoClientSettings settings = MongoClientSettings.builder()
                    .applyConnectionString(new ConnectionString(target.getUrl()))
                    .applyToClusterSettings(b -> b.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                    .applyToSocketSettings(b -> b.connectTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                    .applyToConnectionPoolSettings(b -> b.maxSize(Math.max(1, target.getPoolSize())))
                    .applyToSslSettings(b -> b.enabled(target.isSslEnabled() || sslInUri()))
                    .build();
            client = MongoClients.create(settings);
            database = client.getDatabase(databaseName);
        } catch (MongoException | IllegalArgumentException e) {
            disconnect();
            throw new ConnectionException("Failed to connect to MongoDB: " + e.getMessage(), e);
        }
        log.info("连接器已建立: MONGODB {}", databaseName);
    }

    private boolean sslInUri() {
        if (StringUtils.isBlank(target.getUrl())) {
            return false;
        }
        Boolean ssl = new ConnectionString(target.getUrl()).getSslEnabled();
        return ssl != null && ssl;
    }

    @Override
    public synchronized void disconnect() {
        if (transactionSession != null) {
            transactionSession.close();
            transactionSession = null;
        }
        if (client != null) {
            client.close();
            client = null;
            database = null;
        }
    }

    @Override
    public synchronized boolean isConnected() {
        return client != null;
    }

    private synchronized MongoDatabase db() {
        if (client == null) {
            connect();
        }
        return database;
    }

    @Override
    public HealthCheckResult testConnection() {
        long start = System.currentTimeMillis();
        try {
            db();
            client.getDatabase("admin").runCommand(new Document("ping", 1));
            return HealthCheckResult.healthy(System.currentTimeMillis() - start);
        } catch (Exception e) {
            return HealthCheckResult.unhealthy(System.currentTimeMillis() - start, e.getMessage());
        }
    }

    @Override
    public QueryResult executeQuery(String query, Map<String, Object> params) {
        long start = System.currentTimeMillis();
        Document command;
        try {
            command = Document.parse(query);
        } catch (JsonParseException | IllegalArgumentException e) {
            return QueryResult.error("Invalid JSON query: " + e.getMessage(), System.currentTimeMillis() - start);
        }
        String collectionName = command.getString("collection");
        if (StringUtils.isBlank(collectionName)) {
            return QueryResult.error("Collection name is required in query", System.currentTimeMillis() - start);
        }
        String operation = StringUtils.defaultIfBlank(command.getString("operation"), "find");
        try {
            MongoCollection<Document> collection = db().getCollection(collectionName);
            List<Map<String, Object>> rows;
            switch (operation) {
                case "find":
                    rows = find(collection, command);
                    break;
                case "aggregate":
                    rows = aggregate(collection, command);
                    break;
                case "count":
                    rows = count(collection, command);
                    break;
                case "distinct":
                    rows = distinct(collection, command);
                    break;
                default:
                    return QueryResult.error("Unsupported operation: " + operation, System.currentTimeMillis() - start);
            }
            List<String> columns = rows.isEmpty() ? new ArrayList<>() : new ArrayList<>(rows.get(0).keySet());
            return QueryResult.success(rows, columns, System.currentTimeMillis() - start);
        } catch (MongoException | IllegalArgumentException | ClassCastException | ConnectionException e) {
            return QueryResult.error("Query execution failed: " + e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    private List<Map<String, Object>> find(MongoCollection<Document> collection, Document command) {
        Bson filter = command.get("filter", new Document());
        FindIterable<Document> cursor = transactionSession == null
                ? collection.find(filter) : collection.find(transactionSession, filter);
        Document projection = command.get("projection", Document.class);
        if (projection != null) {
            cursor = cursor.projection(projection);
        }
        Document sort = command.get("sort", Document.class);
        if (sort != null) {
            cursor = cursor.sort(sort);
        }
        int skip = intValue(command.get("skip"), 0);
        if (skip > 0) {
            cursor = cursor.skip(skip);
        }
        cursor = cursor.limit(intValue(command.get("limit"), DEFAULT_LIMIT));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Document doc : cursor) {
            rows.add(toRow(doc));
        }
        return rows;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> aggregate(MongoCollection<Document> collection, Document command) {
        Object pipeline = command.get("pipeline");
        if (pipeline != null && !(pipeline instanceof List)) {
            throw new IllegalArgumentException("Pipeline must be a list of stages");
        }
        List<Document> stages = pipeline == null ? new ArrayList<>() : (List<Document>) pipeline;
        AggregateIterable<Document> cursor = transactionSession == null
                ? collection.aggregate(stages) : collection.aggregate(transactionSession, stages);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Document doc : cursor) {
            rows.add(toRow(doc));
        }
        return rows;
    }

    private List<Map<String, Object>> count(MongoCollection<Document> collection, Document command) {
        Bson filter = command.get("filter", new Document());
        long count = transactionSession == null
                ? collection.countDocuments(filter) : collection.countDocuments(transactionSession, filter);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("count", count);
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row);
        return rows;
    }

    private List<Map<String, Object>> distinct(MongoCollection<Document> collection, Document command) {
        String field = command.getString("field");
        if (StringUtils.isBlank(field)) {
            throw new IllegalArgumentException("Field is required for distinct operation");
        }
        Bson filter = command.get("filter", new Document());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (BsonValue value : collection.distinct(field, filter, BsonValue.class)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(field, fromBson(value));
            rows.add(row);
        }
        return rows;
    }

    private static int intValue(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    static Map<String, Object> toRow(Document doc) {
        Map<String, Object> row = new LinkedHashMap<>();
        doc.forEach((k, v) -> row.put(k, toPlain(v)));
        return row;
    }

    /**
     * BSON 值转成可 JSON 序列化的普通对象
     */
    static Object toPlain(Object value) {
        if (value instanceof ObjectId) {
            return ((ObjectId) value).toHexString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof Decimal128) {
            return ((Decimal128) value).bigDecimalValue();
        }
        if (value instanceof Document) {
            return toRow((Document) value);
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<?>) value) {
                list.add(toPlain(item));
            }
            return list;
        }
        return value;
    }

    static Object fromBson(BsonValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64()) {
            return value.asInt64().getValue();
        }
        if (value.isDouble()) {
            return value.asDouble().getValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        if (value.isObjectId()) {
            return value.asObjectId().getValue().toHexString();
        }
        if (value.isDateTime()) {
            return Instant.ofEpochMilli(value.asDateTime().getValue()).toString();
        }
        if (value.isDecimal128()) {
            return value.asDecimal128().getValue().bigDecimalValue();
        }
        if (value.isDocument()) {
            return toRow(Document.parse(value.asDocument().toJson()));
        }
        return value.toString();
    }

    @Override
    public boolean executeDDL(String sql) {
        throw new UnsupportedOperationException("DDL operations are not supported for MongoDB");
    }

    @Override
    public List<String> listDatabases() {
        db();
        try {
            return client.listDatabaseNames().into(new ArrayList<>());
        } catch (MongoException e) {
            throw new ConnectionException("listDatabases failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listSchemas() {
        return List.of(databaseName);
    }

    @Override
    public List<TableInfo> listTables(String schema) {
        MongoDatabase db = StringUtils.isBlank(schema) ? db() : databaseFor(schema);
        String schemaName = db.getName();
        List<TableInfo> tables = new ArrayList<>();
        try {
            for (String name : db.listCollectionNames()) {
                try {
                    Document stats = db.runCommand(new Document("collStats", name));
                    tables.add(new TableInfo(name, schemaName, longValue(stats.get("count")),
                            longValue(stats.get("size")), "collection"));
                } catch (MongoException e) {
                    // 统计失败时只给出集合名
                    log.debug("collStats 失败: {} {}", name, e.getMessage());
                    tables.add(new TableInfo(name, schemaName, "collection"));
                }
            }
        } catch (MongoException e) {
            throw new ConnectionException("listTables failed: " + e.getMessage(), e);
        }
        return tables;
    }

    private MongoDatabase databaseFor(String schema) {
        db();
        return client.getDatabase(schema);
    }

    private static Long longValue(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    @Override
    public TableSchema getTableSchema(String table, String schema) {
        MongoDatabase db = StringUtils.isBlank(schema) ? db() : databaseFor(schema);
        TreeSet<String> fields = new TreeSet<>();
        try {
            for (Document doc : db.getCollection(table).find().limit(SCHEMA_SAMPLE_SIZE)) {
                fields.addAll(doc.keySet());
            }
        } catch (MongoException e) {
            throw new ConnectionException("getTableSchema failed: " + e.getMessage(), e);
        }
        List<ColumnInfo> columns = new ArrayList<>();
        for (String field : fields) {
            columns.add(new ColumnInfo(field, "mixed", true, null, "_id".equals(field), false));
        }
        return new TableSchema(table, db.getName(), columns, List.of("_id"), new ArrayList<>(), new ArrayList<>());
    }

    @Override
    public synchronized void startTransaction() {
        db();
        if (transactionSession != null) {
            throw new IllegalStateException("Transaction already started");
        }
        transactionSession = client.startSession();
        transactionSession.startTransaction();
    }

    @Override
    public synchronized void commit() {
        if (transactionSession == null) {
            return;
        }
        try {
            transactionSession.commitTransaction();
        } finally {
            transactionSession.close();
            transactionSession = null;
        }
    }

    @Override
    public synchronized void rollback() {
        if (transactionSession == null) {
            return;
        }
        try {
            transactionSession.abortTransaction();
        } finally {
            transactionSession.close();
            transactionSession = null;
        }
    }

    @Override
    public DatabaseCapabilities detectCapabilities() {
        db();
        try {
            MongoDatabase admin = client.getDatabase("admin");
            Document buildInfo = admin.runCommand(new Document("buildInfo", 1));
            Document hello = admin.runCommand(new Document("hello", 1));
            String version = buildInfo.getString("version");
            boolean replicaSet = hello.containsKey("setName");
            boolean sharded = "isdbgrid".equals(hello.getString("msg"));
            Object maxConnections = hello.get("maxConnections");
            return DatabaseCapabilities.builder()
                    .version(version == null ? "Unknown" : version)
                    .supportsTransactions(supportsTransactions(version, replicaSet, sharded))
                    .supportsStoredProcedures(false)
                    .supportsViews(true)
                    .supportsMaterializedViews(false)
                    .supportsJson(true)
                    .supportsFullTextSearch(true)
                    .maxConnections(maxConnections instanceof Number ? ((Number) maxConnections).intValue() : 100)
                    .features(List.of("Document Store", "Aggregation Pipeline", "Geospatial", "Text Search"))
                    .build();
        } catch (MongoException e) {
            throw new ConnectionException("detectCapabilities failed: " + e.getMessage(), e);
        }
    }

    /**
     * 多文档事务需要 4.0+ 且部署为副本集或分片集群
     */
    static boolean supportsTransactions(String version, boolean replicaSet, boolean sharded) {
        if (!replicaSet && !sharded) {
            return false;
        }
        if (version == null) {
            return false;
        }
        String major = version.split("\\.")[0];
        try {
            return Integer.parseInt(major) >= 4;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
